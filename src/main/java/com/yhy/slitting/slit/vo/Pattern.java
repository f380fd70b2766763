package com.yhy.slitting.slit.vo;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Unordered outcome of selecting orders for one coil. Cuts are listed in order-index order.
 */
@Value
@Builder(toBuilder = true)
public class Pattern {

    Coil coil;
    List<Double> cuts;
    List<Integer> orderIndices;
    double totalLength;

    public static Pattern empty(Coil coil) {
        return new Pattern(coil, Collections.emptyList(), Collections.emptyList(), 0.0);
    }

    /**
     * Builds a pattern from the selected positions of {@code orders}; indices must be ascending.
     */
    public static Pattern of(Coil coil, List<Order> orders, List<Integer> selected) {
        List<Double> cuts = new ArrayList<>(selected.size());
        BigDecimal total = BigDecimal.ZERO;
        for (int idx : selected) {
            Order o = orders.get(idx);
            cuts.add(o.getWidth());
            total = total.add(BigDecimal.valueOf(o.getLength()));
        }
        return new Pattern(coil, List.copyOf(cuts), List.copyOf(selected), total.doubleValue());
    }

    public double getUsedWidth() {
        return usedWidth().doubleValue();
    }

    public double getRemainingWidth() {
        return BigDecimal.valueOf(coil.getWidth()).subtract(usedWidth()).doubleValue();
    }

    public double getUtilization() {
        if (coil.getWidth() <= 0) return 0.0;
        return round2(getUsedWidth() / coil.getWidth());
    }

    /** 按当前顺序切割时的刀具移动量 */
    public double getBladeTravel() {
        return bladeTravel(cuts);
    }

    /**
     * Sum of width differences between consecutive cuts.
     */
    public static double bladeTravel(List<Double> cuts) {
        BigDecimal travel = BigDecimal.ZERO;
        for (int i = 1; i < cuts.size(); i++) {
            travel = travel.add(BigDecimal.valueOf(cuts.get(i)).subtract(BigDecimal.valueOf(cuts.get(i - 1))).abs());
        }
        return travel.doubleValue();
    }

    public boolean isEmpty() {
        return cuts.isEmpty();
    }

    /** 容量约束：sum(cuts) <= coil.width，按十进制精确比较 */
    public boolean fitsCoil() {
        return usedWidth().compareTo(BigDecimal.valueOf(coil.getWidth())) <= 0;
    }

    private BigDecimal usedWidth() {
        BigDecimal s = BigDecimal.ZERO;
        for (double c : cuts) s = s.add(BigDecimal.valueOf(c));
        return s;
    }

    private static double round2(double v) {
        return BigDecimal.valueOf(v).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
