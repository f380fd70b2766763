package com.yhy.slitting.slit.vo;

public enum FailureType {
    /** 母卷数据非法 */
    INVALID_INPUT,
    /** 求解器未能给出满足容量约束的结果 */
    INFEASIBLE,
    /** 整体截止时间已到，该母卷未完成 */
    DEADLINE_EXCEEDED
}
