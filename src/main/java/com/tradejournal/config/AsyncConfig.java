package com.tradejournal.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded worker pool for per-instrument candle fetches during enrichment.
 * When the queue is full the submitting thread runs the fetch itself.
 */
@Configuration
public class AsyncConfig {

    @Bean("enrichmentExecutor")
    public ThreadPoolTaskExecutor enrichmentExecutor(
            @Value("${tradejournal.async.core-pool-size:4}") int corePoolSize,
            @Value("${tradejournal.async.max-pool-size:8}") int maxPoolSize,
            @Value("${tradejournal.async.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("enrich-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        // in-flight candle fetches are abandoned on shutdown; a later sync redoes them
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
