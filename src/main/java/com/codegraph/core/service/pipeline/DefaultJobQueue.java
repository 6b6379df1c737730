package com.codegraph.core.service.pipeline;

import com.codegraph.core.service.config.MetricsConfig;
import com.codegraph.core.service.config.PipelineConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Default implementation of JobQueue using a bounded BlockingQueue.
 *
 * Submission never blocks; a full queue is reported to the caller as backpressure.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DefaultJobQueue implements JobQueue {

    private final PipelineConfig config;
    private final MetricsConfig metricsConfig;

    private BlockingQueue<JobWorkItem> queue;
    private int capacity;

    @PostConstruct
    void init() {
        this.capacity = config.getQueue().getCapacity();
        this.queue = new LinkedBlockingQueue<>(capacity);

        metricsConfig.registerQueueGauge(
                "codegraph.jobs.queue.size",
                "Current job queue size",
                this::size
        );
        metricsConfig.registerQueueGauge(
                "codegraph.jobs.queue.utilization",
                "Job queue utilization percentage",
                this::getUtilizationPercent
        );

        log.info("JobQueue initialized with capacity: {}", capacity);
    }

    @Override
    public boolean enqueue(JobWorkItem item) {
        boolean offered = queue.offer(item);
        if (!offered) {
            log.warn("Queue full, rejecting job: {}", item.jobId());
        } else {
            log.debug("Enqueued job: {}", item.jobId());
        }
        return offered;
    }

    @Override
    public Optional<JobWorkItem> dequeue(long timeoutMs) {
        try {
            JobWorkItem item = queue.poll(timeoutMs, TimeUnit.MILLISECONDS);
            if (item != null) {
                log.debug("Dequeued job: {}", item.jobId());
            }
            return Optional.ofNullable(item);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Interrupted while dequeuing job");
            return Optional.empty();
        }
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public int getCapacity() {
        return capacity;
    }
}
