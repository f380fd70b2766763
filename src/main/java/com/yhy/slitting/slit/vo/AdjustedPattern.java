package com.yhy.slitting.slit.vo;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Pattern cuts after shear adjustment: same widths, ascending.
 */
@Value
@Builder
public class AdjustedPattern {
    Coil coil;
    List<Double> cuts;
    // 相邻两刀之间的刀具移动量之和
    double bladeTravel;

    /**
     * Views this adjusted pattern as an unordered pattern again, keeping the cut order.
     */
    public Pattern asPattern() {
        return Pattern.builder()
                .coil(coil)
                .cuts(cuts)
                .orderIndices(List.of())
                .totalLength(0.0)
                .build();
    }
}
