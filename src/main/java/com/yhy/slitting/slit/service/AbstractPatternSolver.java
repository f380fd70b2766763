package com.yhy.slitting.slit.service;

import com.yhy.slitting.config.SlittingProperties;
import com.yhy.slitting.slit.exception.InvalidInputException;
import com.yhy.slitting.slit.exception.OptimizationInfeasibleException;
import com.yhy.slitting.slit.vo.Coil;
import com.yhy.slitting.slit.vo.InvalidRecord;
import com.yhy.slitting.slit.vo.Order;
import com.yhy.slitting.slit.vo.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Shared front half of every strategy: checks, drops orders that cannot fit, and converts
 * widths/lengths to exact integer units before handing a 0/1 knapsack to {@link #select(Scaled)}.
 */
public abstract class AbstractPatternSolver implements IPatternSolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(AbstractPatternSolver.class);

    protected final SlittingProperties.Solver config;

    protected AbstractPatternSolver(SlittingProperties properties) {
        this.config = properties.getSolver();
    }

    // ===== 按输入精度换算成整数后的候选订单 =====
    protected static final class Scaled {
        final int capacity;       // coil.width * 10^widthDecimals
        final int[] orderIdx;     // 候选 -> 原始订单下标（升序）
        final int[] w;            // order.width * 10^widthDecimals
        final long[] v;           // order.length * 10^lengthDecimals

        Scaled(int capacity, int[] orderIdx, int[] w, long[] v) {
            this.capacity = capacity;
            this.orderIdx = orderIdx;
            this.w = w;
            this.v = v;
        }

        int size() {
            return w.length;
        }
    }

    @Override
    public Pattern solve(Coil coil, List<Order> orders) {
        Optional<InvalidRecord> badCoil = InputValidator.checkCoil(0, coil);
        if (badCoil.isPresent()) {
            throw new InvalidInputException(badCoil.get());
        }
        if (orders == null || orders.isEmpty()) {
            return Pattern.empty(coil);
        }
        Scaled scaled = scale(coil, orders);
        if (scaled.capacity == 0 || scaled.size() == 0) {
            return Pattern.empty(coil);
        }

        int[] chosen = select(scaled);

        List<Integer> selected = new ArrayList<>(chosen.length);
        for (int k : chosen) {
            selected.add(scaled.orderIdx[k]);
        }
        selected.sort(Integer::compare);
        return Pattern.of(coil, orders, selected);
    }

    /**
     * Solves the scaled knapsack and returns chosen candidate positions.
     */
    protected abstract int[] select(Scaled scaled);

    /**
     * Converts widths and lengths to exact integers, using the largest number of decimals found in
     * the input. Input finer than the configured limits is refused rather than rounded.
     */
    Scaled scale(Coil coil, List<Order> orders) {
        List<Integer> idx = new ArrayList<>();
        int widthDecimals = decimals(coil.getWidth());
        int lengthDecimals = 0;
        for (int i = 0; i < orders.size(); i++) {
            Order o = orders.get(i);
            Optional<InvalidRecord> bad = InputValidator.checkOrder(i, o);
            if (bad.isPresent()) {
                throw new InvalidInputException(bad.get());
            }
            // 单件即超宽的订单不参与选择
            if (o.getWidth() > coil.getWidth()) continue;
            idx.add(i);
            widthDecimals = Math.max(widthDecimals, decimals(o.getWidth()));
            lengthDecimals = Math.max(lengthDecimals, decimals(o.getLength()));
        }
        if (idx.isEmpty() || coil.getWidth() == 0) {
            return new Scaled(0, new int[0], new int[0], new long[0]);
        }
        if (widthDecimals > config.getMaxWidthDecimals()) {
            throw new OptimizationInfeasibleException("widths need " + widthDecimals + " decimals, limit is "
                    + config.getMaxWidthDecimals());
        }
        if (lengthDecimals > config.getMaxLengthDecimals()) {
            throw new OptimizationInfeasibleException("lengths need " + lengthDecimals + " decimals, limit is "
                    + config.getMaxLengthDecimals());
        }

        long cap = units(coil.getWidth(), widthDecimals);
        if (cap > Integer.MAX_VALUE) {
            throw new OptimizationInfeasibleException("coil width " + coil.getWidth() + " with "
                    + widthDecimals + " decimals is too large");
        }

        int n = idx.size();
        int[] orderIdx = new int[n];
        int[] w = new int[n];
        long[] v = new long[n];
        long total = 0L;
        for (int k = 0; k < n; k++) {
            Order o = orders.get(idx.get(k));
            orderIdx[k] = idx.get(k);
            w[k] = (int) units(o.getWidth(), widthDecimals);
            v[k] = units(o.getLength(), lengthDecimals);
            try {
                total = Math.addExact(total, v[k]);
            } catch (ArithmeticException e) {
                throw new OptimizationInfeasibleException("total order length overflows with "
                        + lengthDecimals + " decimals", e);
            }
        }
        LOGGER.debug("scaled {} candidates: width 10^{}, length 10^{}, capacity {}",
                n, widthDecimals, lengthDecimals, cap);
        return new Scaled((int) cap, orderIdx, w, v);
    }

    static int decimals(double x) {
        return Math.max(0, BigDecimal.valueOf(x).stripTrailingZeros().scale());
    }

    static long units(double x, int decimals) {
        try {
            return BigDecimal.valueOf(x).movePointRight(decimals).longValueExact();
        } catch (ArithmeticException e) {
            throw new OptimizationInfeasibleException(x + " does not fit in 64 bits at " + decimals + " decimals", e);
        }
    }
}
