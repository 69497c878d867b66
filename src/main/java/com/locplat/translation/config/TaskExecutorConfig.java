package com.locplat.translation.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class TaskExecutorConfig {

    @Value("${app.translation.executor.core-pool-size:4}")
    private int corePoolSize;

    @Value("${app.translation.executor.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${app.translation.executor.queue-capacity:500}")
    private int queueCapacity;

    /**
     * Runs provider calls for batched fields. When the queue is full the caller thread
     * does the work itself, which throttles the request instead of rejecting it.
     */
    @Bean("translationExecutor")
    public ThreadPoolTaskExecutor translationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(Math.max(corePoolSize, maxPoolSize));
        executor.setQueueCapacity(queueCapacity);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("TranslationWorker-");
        executor.initialize();
        return executor;
    }
}
