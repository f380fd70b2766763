package com.yhy.slitting.slit.vo;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 母卷：宽度为可分切容量，长度只随结果带出，不参与目标函数。
 */
@Value
@Builder
@Jacksonized
public class Coil {
    double width;
    double length;

    public static Coil of(double width, double length) {
        return Coil.builder().width(width).length(length).build();
    }
}
