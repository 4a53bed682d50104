package com.kotsin.enrichment.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionException;

/**
 * AsyncConfig - Thread pools for the enrichment core.
 *
 * Provides:
 * - enrichmentExecutor: bounded pool running provider calls
 * - learningExecutor: single thread for failure model retraining
 */
@Configuration
@EnableAsync
@Slf4j
public class AsyncConfig {

    @Value("${enrichment.executor.pool-size:4}")
    private int enrichmentPoolSize;

    @Value("${enrichment.executor.queue-capacity:100}")
    private int enrichmentQueueCapacity;

    /**
     * Executor for provider calls. Fixed size so at most pool-size providers run at once.
     *
     * A full queue rejects the call instead of running it on the caller thread, which
     * would escape the per-call timeout. The orchestrator reports the rejection as a
     * provider error.
     */
    @Bean(name = "enrichmentExecutor")
    public ThreadPoolTaskExecutor enrichmentExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(enrichmentPoolSize);
        executor.setMaxPoolSize(enrichmentPoolSize);
        executor.setQueueCapacity(enrichmentQueueCapacity);
        executor.setThreadNamePrefix("enrichment-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("[ENRICH-EXECUTOR] Queue full, rejecting provider call. activeCount={}, queueSize={}",
                    e.getActiveCount(), e.getQueue().size());
            throw new RejectedExecutionException("enrichment queue full");
        });

        // Abandoned calls are interrupted, not waited for
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();

        log.info("[ENRICH-EXECUTOR] Initialized: poolSize={}, queueCapacity={}",
                enrichmentPoolSize, enrichmentQueueCapacity);
        return executor;
    }

    @Bean(name = "learningExecutor")
    public ThreadPoolTaskExecutor learningExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(4);
        executor.setThreadNamePrefix("learning-");
        executor.setRejectedExecutionHandler((r, e) ->
                log.debug("[LEARNING] Retrain already queued, dropping request"));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
