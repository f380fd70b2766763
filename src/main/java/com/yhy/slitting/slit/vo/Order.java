package com.yhy.slitting.slit.vo;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * 客户订单：宽度占用母卷容量，长度为要满足的价值。
 */
@Value
@Builder
@Jacksonized
public class Order {
    double width;
    double length;

    public static Order of(double width, double length) {
        return Order.builder().width(width).length(length).build();
    }
}
