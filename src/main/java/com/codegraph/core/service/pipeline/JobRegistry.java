package com.codegraph.core.service.pipeline;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of job snapshots.
 *
 * Transitions on a job in a terminal state are no-ops that return the current snapshot.
 * Operations on an unknown job id throw a {@link PipelineException} with
 * {@link PipelineException#JOB_NOT_FOUND}.
 */
public interface JobRegistry {

    /**
     * Registers a new job.
     *
     * @throws IllegalStateException if a job with the same id already exists
     */
    Job create(Job job);

    Optional<Job> find(String jobId);

    Job markRunning(String jobId);

    /**
     * Records progress. Progress never decreases and is clamped to [0, 1].
     */
    Job updateProgress(String jobId, double progress, String message);

    Job complete(String jobId, Map<String, Object> result);

    Job fail(String jobId, String errorMessage);

    Job cancel(String jobId);

    /**
     * Cancels the job only while it is still pending.
     *
     * @return the resulting snapshot; its status tells whether the cancellation applied
     */
    Job cancelIfPending(String jobId);

    /**
     * All jobs, newest first.
     */
    List<Job> list();

    /**
     * Removes terminal jobs completed before {@code completedBefore}, then the oldest
     * terminal jobs until at most {@code maxRetained} jobs remain.
     *
     * @return number of evicted jobs
     */
    int evict(Instant completedBefore, int maxRetained);

    int size();
}
