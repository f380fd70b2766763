package com.yhy.slitting.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 分切优化配置，前缀 slitting。
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "slitting")
public class SlittingProperties {

    private Solver solver = new Solver();

    private PlanRun plan = new PlanRun();

    @Data
    public static class Solver {
        /** 默认求解策略：dp / mip / relaxed */
        private String defaultStrategy = "dp";
        /** 宽度最多允许的小数位，超出则该卷不求解 */
        private int maxWidthDecimals = 4;
        /** 长度最多允许的小数位 */
        private int maxLengthDecimals = 6;
        /** 单次 dp 求解的内存上限（字节），超出请改用 mip */
        private long maxTableBytes = 64L * 1024 * 1024;
        /** mip 求解时间上限 */
        private long timeLimitMs = 10_000L;
    }

    @Data
    public static class PlanRun {
        /** 工作线程数，0 表示按 CPU 核数 */
        private int threads = 0;
        /** 整体截止时间，0 表示不限 */
        private long deadlineMs = 0L;
    }
}
