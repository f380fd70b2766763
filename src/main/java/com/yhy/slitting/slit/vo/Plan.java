package com.yhy.slitting.slit.vo;

import com.yhy.slitting.slit.exception.AssemblyPartialFailureException;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result of one optimization run: a slot per input coil, in input order.
 */
@Value
@Builder
public class Plan {
    String id;
    String strategy;
    List<PlanSlot> slots;
    List<InvalidRecord> rejectedOrders;

    public long getFailedCount() {
        return slots.stream().filter(PlanSlot::isFailed).count();
    }

    public boolean isPartialFailure() {
        return getFailedCount() > 0;
    }

    /**
     * Returns this plan when every slot succeeded, otherwise throws.
     */
    public Plan requireComplete() {
        if (isPartialFailure()) {
            throw new AssemblyPartialFailureException(this);
        }
        return this;
    }
}
