package com.yhy.slitting.slit.vo;

import lombok.Value;

@Value
public class SlotFailure {
    FailureType type;
    String message;
}
