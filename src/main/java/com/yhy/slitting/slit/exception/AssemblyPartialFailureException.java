package com.yhy.slitting.slit.exception;

import com.yhy.slitting.slit.vo.Plan;

/**
 * Raised by {@link Plan#requireComplete()} when some coils failed. The plan is still attached.
 */
public class AssemblyPartialFailureException extends SlittingException {

    private final transient Plan plan;

    public AssemblyPartialFailureException(Plan plan) {
        super(plan.getFailedCount() + " of " + plan.getSlots().size() + " coils failed");
        this.plan = plan;
    }

    public Plan getPlan() {
        return plan;
    }
}
