package com.yhy.slitting.slit.vo;

import lombok.Value;

@Value
public class InvalidRecord {

    public enum Kind { COIL, ORDER }

    Kind kind;
    int index;
    String reason;
}
