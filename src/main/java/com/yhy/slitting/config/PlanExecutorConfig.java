package com.yhy.slitting.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class PlanExecutorConfig {

    /**
     * Bounded pool solving coils of a plan in parallel.
     */
    @Bean(name = "planExecutor", destroyMethod = "shutdown")
    public ExecutorService planExecutor(SlittingProperties properties) {
        int configured = properties.getPlan().getThreads();
        int threads = configured > 0 ? configured : Math.max(1, Runtime.getRuntime().availableProcessors());
        AtomicInteger counter = new AtomicInteger(0);
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "slit-plan-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
