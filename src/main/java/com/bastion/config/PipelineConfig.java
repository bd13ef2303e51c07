package com.bastion.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Shared infrastructure beans for the ingestion pipeline.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Bounded pool for ingestion runs. When the queue is full the submitting
     * thread gets a TaskRejectedException; the scheduler simply retries the
     * source on a later tick.
     */
    @Bean(name = "ingestionExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor ingestionExecutor(
            @Value("${bastion.ingestion.worker-threads:4}") int workerThreads,
            @Value("${bastion.ingestion.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workerThreads);
        executor.setMaxPoolSize(workerThreads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("ingest-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Ingestion executor initialized: threads={}, queueCapacity={}", workerThreads, queueCapacity);
        return executor;
    }

    /**
     * Single thread used for coalesced export regeneration requested by
     * ingestion runs.
     */
    @Bean(name = "exportExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor exportExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("export-");
        executor.initialize();
        return executor;
    }
}
