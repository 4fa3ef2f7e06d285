package com.deepansh.kernel.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools kept apart from the web pool.
 *
 * - toolTaskExecutor: tool calls, one thread per call in flight. No queue; per-turn
 *   concurrency is bounded by the dispatcher, which holds calls back while the pool is
 *   full. Sub-agent turns also run here, one level deeper each, hence the generous max.
 * - streamTaskExecutor: drives streaming turns while the request thread returns the emitter.
 * - usageTaskExecutor: usage event writes to MongoDB.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "toolTaskExecutor")
    public ThreadPoolTaskExecutor toolTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(8);
        executor.setMaxPoolSize(256);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("tool-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean(name = "streamTaskExecutor")
    public ThreadPoolTaskExecutor streamTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(32);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("turn-stream-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "usageTaskExecutor")
    public ThreadPoolTaskExecutor usageTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("usage-async-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
