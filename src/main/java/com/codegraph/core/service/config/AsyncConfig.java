package com.codegraph.core.service.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Async configuration.
 *
 * Job workers own their threads; this class provides the shared pool used to parse and
 * extract files in parallel within a job.
 */
@Slf4j
@Configuration
@EnableAsync
@RequiredArgsConstructor
public class AsyncConfig {

    private final PipelineConfig pipelineConfig;

    // ==================== Executor Beans ====================

    /**
     * Executor for per-file parsing and extraction.
     * The caller runs the task itself when the queue is full.
     */
    @Bean(name = "extractionExecutor")
    public ThreadPoolTaskExecutor extractionExecutor() {
        int parallelism = Math.max(1, pipelineConfig.getExtractionParallelism());
        log.info("Initializing extraction executor with {} threads", parallelism);
        return createPlatformThreadPool("extract-", parallelism, parallelism, 1000);
    }

    // ==================== Helper Methods ====================

    private ThreadPoolTaskExecutor createPlatformThreadPool(String prefix, int coreSize,
                                                            int maxSize, int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
