package com.codegraph.core.service.pipeline;

import com.codegraph.core.service.config.MetricsConfig;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * In-memory implementation of JobRegistry.
 * Each job lives in its own AtomicReference so status reads never block a running job.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InMemoryJobRegistry implements JobRegistry {

    private final MetricsConfig metricsConfig;

    private final Map<String, AtomicReference<Job>> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        metricsConfig.registerRegistryGauge(
                "codegraph.jobs.registry.size",
                "Number of jobs held in memory",
                this::size
        );
    }

    // ==================== JobRegistry Interface ====================

    @Override
    public Job create(Job job) {
        var previous = jobs.putIfAbsent(job.id(), new AtomicReference<>(job));
        if (previous != null) {
            throw new IllegalStateException("Job already registered: " + job.id());
        }
        log.debug("Job registered: {}", job.id());
        return job;
    }

    @Override
    public Optional<Job> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(AtomicReference::get);
    }

    @Override
    public Job markRunning(String jobId) {
        return transition(jobId, job -> job.status() != JobStatus.PENDING ? job : job.toBuilder()
                .status(JobStatus.RUNNING)
                .startedAt(Instant.now())
                .build());
    }

    @Override
    public Job updateProgress(String jobId, double progress, String message) {
        double clamped = Math.min(1.0, Math.max(0.0, progress));
        return transition(jobId, job -> job.toBuilder()
                .progress(Math.max(job.progress(), clamped))
                .progressMessage(message != null ? message : job.progressMessage())
                .build());
    }

    @Override
    public Job complete(String jobId, Map<String, Object> result) {
        return transition(jobId, job -> job.toBuilder()
                .status(JobStatus.COMPLETED)
                .progress(1.0)
                .progressMessage("Completed")
                .completedAt(Instant.now())
                .result(result)
                .build());
    }

    @Override
    public Job fail(String jobId, String errorMessage) {
        return transition(jobId, job -> job.toBuilder()
                .status(JobStatus.FAILED)
                .completedAt(Instant.now())
                .errorMessage(errorMessage)
                .build());
    }

    @Override
    public Job cancel(String jobId) {
        return transition(jobId, job -> job.toBuilder()
                .status(JobStatus.CANCELLED)
                .progressMessage("Cancelled")
                .completedAt(Instant.now())
                .build());
    }

    @Override
    public Job cancelIfPending(String jobId) {
        return transition(jobId, job -> job.status() != JobStatus.PENDING ? job : job.toBuilder()
                .status(JobStatus.CANCELLED)
                .progressMessage("Cancelled")
                .completedAt(Instant.now())
                .build());
    }

    @Override
    public List<Job> list() {
        return jobs.values().stream()
                .map(AtomicReference::get)
                .sorted(Comparator.comparing(Job::createdAt).reversed())
                .toList();
    }

    @Override
    public int evict(Instant completedBefore, int maxRetained) {
        int evicted = 0;
        List<Job> terminal = jobs.values().stream()
                .map(AtomicReference::get)
                .filter(Job::isTerminal)
                .sorted(Comparator.comparing(Job::completedAt))
                .toList();

        for (Job job : terminal) {
            boolean expired = completedBefore != null && job.completedAt().isBefore(completedBefore);
            boolean overCapacity = jobs.size() > maxRetained;
            if (!expired && !overCapacity) {
                continue;
            }
            if (jobs.remove(job.id()) != null) {
                evicted++;
            }
        }

        if (evicted > 0) {
            log.info("Evicted {} finished jobs, {} remaining", evicted, jobs.size());
        }
        return evicted;
    }

    @Override
    public int size() {
        return jobs.size();
    }

    // ==================== Private Helpers ====================

    /**
     * Applies an update unless the job has already reached a terminal state.
     */
    private Job transition(String jobId, UnaryOperator<Job> update) {
        var reference = jobs.get(jobId);
        if (reference == null) {
            throw PipelineException.jobNotFound(jobId);
        }
        return reference.updateAndGet(job -> job.isTerminal() ? job : update.apply(job));
    }
}
