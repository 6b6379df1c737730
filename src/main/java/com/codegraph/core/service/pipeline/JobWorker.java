package com.codegraph.core.service.pipeline;

import com.codegraph.core.service.config.PipelineConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker service that takes jobs from the job queue and runs them.
 *
 * Each worker thread runs one job at a time; jobs of different workers run concurrently.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobWorker {

    private final JobQueue queue;
    private final PipelineOrchestrator orchestrator;
    private final PipelineConfig pipelineConfig;

    private ExecutorService executorService;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger activeWorkers = new AtomicInteger(0);

    // ==================== Lifecycle ====================

    @PostConstruct
    void start() {
        int workerCount = Math.max(1, pipelineConfig.getWorker().getThreadCount());
        executorService = Executors.newFixedThreadPool(workerCount, this::createWorkerThread);
        running.set(true);
        for (int i = 0; i < workerCount; i++) {
            executorService.submit(this::processLoop);
        }
        log.info("JobWorker started with {} worker threads", workerCount);
    }

    @PreDestroy
    void stop() {
        running.set(false);
        shutdownExecutor();
        log.info("JobWorker stopped. Final active workers: {}", activeWorkers.get());
    }

    // ==================== Executor Management ====================

    private Thread createWorkerThread(Runnable runnable) {
        var thread = new Thread(runnable);
        thread.setName("job-worker-" + thread.getId());
        thread.setDaemon(true);
        return thread;
    }

    private void shutdownExecutor() {
        int timeoutSeconds = pipelineConfig.getWorker().getShutdownTimeoutSeconds();
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                log.warn("Forcing shutdown of job workers");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executorService.shutdownNow();
        }
    }

    // ==================== Processing Loop ====================

    private void processLoop() {
        activeWorkers.incrementAndGet();
        long pollTimeoutMs = pipelineConfig.getWorker().getPollMs();

        try {
            while (running.get()) {
                processNextItem(pollTimeoutMs);
            }
        } finally {
            activeWorkers.decrementAndGet();
        }
    }

    private void processNextItem(long pollTimeoutMs) {
        try {
            queue.dequeue(pollTimeoutMs)
                    .ifPresent(this::processWorkItem);
        } catch (Exception e) {
            log.error("Error in job worker loop", e);
        }
    }

    private void processWorkItem(JobWorkItem item) {
        try {
            orchestrator.execute(item);
        } catch (PipelineException e) {
            log.error("Job {} could not be run: {} [{}]", item.jobId(), e.getMessage(), e.getErrorCode());
        } catch (Exception e) {
            log.error("Unexpected error running job {}", item.jobId(), e);
        }
    }

    // ==================== Monitoring ====================

    /**
     * Returns the current number of active workers.
     */
    public int getActiveWorkerCount() {
        return activeWorkers.get();
    }
}
