package com.eyelevel.tableingestor.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools of the ingestion service. Each file runs to completion on one
 * {@code ingestionWorkerExecutor} thread; stage futures and OCR pages get their own pools so a
 * waiting worker never starves the work it waits for.
 */
@Configuration
@RequiredArgsConstructor
public class TaskExecutorConfig {

    private final IngestionConfig config;

    /**
     * Bounded worker pool. When saturated the submitting trigger runs the job itself, which
     * throttles the trigger source.
     */
    @Bean("ingestionWorkerExecutor")
    public ThreadPoolTaskExecutor ingestionWorkerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getWorkerPoolSize());
        executor.setMaxPoolSize(config.getWorkerPoolSize());
        executor.setQueueCapacity(config.getWorkerQueueCapacity());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setThreadNamePrefix("ingest-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Stage pool. Rejects when saturated: a stage run on the caller's thread could not be timed out.
     */
    @Bean("stageExecutor")
    public ThreadPoolTaskExecutor stageExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getWorkerPoolSize());
        executor.setMaxPoolSize(config.getWorkerPoolSize() * 2);
        executor.setQueueCapacity(0);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setThreadNamePrefix("ingest-stage-");
        executor.initialize();
        return executor;
    }

    @Bean("ocrPageExecutor")
    public ThreadPoolTaskExecutor ocrPageExecutor() {
        int threads = Math.max(1, config.getWorkerPoolSize() * config.getOcr().getPageConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("ocr-page-");
        executor.initialize();
        return executor;
    }
}
