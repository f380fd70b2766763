package com.yhy.slitting.slit.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * One position of a plan, matching the coil at the same position of the input.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PlanSlot {
    int index;
    Coil coil;
    SlotStatus status;
    Pattern pattern;
    AdjustedPattern adjustedPattern;
    SlotFailure failure;

    public static PlanSlot sequenced(int index, Coil coil, Pattern pattern, AdjustedPattern adjusted) {
        return new PlanSlot(index, coil, SlotStatus.SEQUENCED, pattern, adjusted, null);
    }

    public static PlanSlot failed(int index, Coil coil, FailureType type, String message) {
        return new PlanSlot(index, coil, SlotStatus.FAILED, null, null, new SlotFailure(type, message));
    }

    public boolean isFailed() {
        return status == SlotStatus.FAILED;
    }
}
