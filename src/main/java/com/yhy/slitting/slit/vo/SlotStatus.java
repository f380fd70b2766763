package com.yhy.slitting.slit.vo;

public enum SlotStatus {
    SEQUENCED,
    FAILED
}
