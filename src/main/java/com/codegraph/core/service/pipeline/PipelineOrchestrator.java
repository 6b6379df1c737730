package com.codegraph.core.service.pipeline;

import com.codegraph.core.service.api.dto.EnhancementRequest;
import com.codegraph.core.service.config.MetricsConfig;
import com.codegraph.core.service.ingest.RepoSpec;
import com.codegraph.core.service.model.Language;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Entry point for enhancement jobs: submission, status, cancellation and execution.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PipelineOrchestrator {

    private final JobRegistry jobRegistry;
    private final JobQueue jobQueue;
    private final EnhancementPipeline pipeline;
    private final MetricsConfig metricsConfig;

    private final Set<String> cancelRequests = ConcurrentHashMap.newKeySet();

    // ==================== Submission ====================

    /**
     * Registers a pending job and queues it for a worker.
     *
     * @throws PipelineException with {@link PipelineException#QUEUE_FULL} when the queue rejects the job;
     *                           the registered job is marked failed
     * @throws IllegalArgumentException when the request names an unknown language
     */
    public Job submit(EnhancementRequest request) {
        String jobId = UUID.randomUUID().toString();
        String repoId = hasText(request.getRepoId()) ? request.getRepoId() : jobId;
        RepoSpec spec = toRepoSpec(repoId, request);

        Job job = jobRegistry.create(Job.pending(jobId, JobKind.ENHANCEMENT, repoId, metadata(request)));

        if (!jobQueue.enqueue(new JobWorkItem(jobId, spec, request.isDryRun()))) {
            int utilization = jobQueue.getUtilizationPercent();
            jobRegistry.fail(jobId, "Job queue is full");
            throw PipelineException.queueFull(jobId, utilization);
        }

        metricsConfig.getJobsSubmitted().increment();
        log.info("Job {} submitted for {} (repoId={}, dryRun={})",
                jobId, request.getRepoUrl(), repoId, request.isDryRun());
        return job;
    }

    // ==================== Status ====================

    public Job getStatus(String jobId) {
        return jobRegistry.find(jobId).orElseThrow(() -> PipelineException.jobNotFound(jobId));
    }

    public List<Job> list() {
        return jobRegistry.list();
    }

    // ==================== Cancellation ====================

    /**
     * Cancels a job. A pending job is cancelled at once; a running job stops at its next
     * stage boundary. Cancelling a finished job returns it unchanged.
     */
    public Job cancel(String jobId) {
        Job job = getStatus(jobId);
        if (job.isTerminal()) {
            return job;
        }
        if (job.status() == JobStatus.PENDING) {
            Job cancelled = jobRegistry.cancelIfPending(jobId);
            if (cancelled.status() == JobStatus.CANCELLED) {
                metricsConfig.getJobsCancelled().increment();
                log.info("Pending job {} cancelled", jobId);
                return cancelled;
            }
            // picked up by a worker in the meantime
        }
        cancelRequests.add(jobId);
        log.info("Cancellation requested for running job {}", jobId);
        Job current = getStatus(jobId);
        if (current.isTerminal()) {
            cancelRequests.remove(jobId);
        }
        return current;
    }

    // ==================== Execution ====================

    /**
     * Runs a dequeued work item on the calling thread.
     */
    public void execute(JobWorkItem item) {
        String jobId = item.jobId();
        try {
            pipeline.run(item, () -> cancelRequests.contains(jobId));
        } finally {
            cancelRequests.remove(jobId);
        }
    }

    // ==================== Helper Methods ====================

    static RepoSpec toRepoSpec(String repoId, EnhancementRequest request) {
        Set<Language> languages = new LinkedHashSet<>();
        if (request.getLanguages() != null) {
            request.getLanguages().forEach(name -> languages.add(Language.fromValue(name)));
        }
        return new RepoSpec(repoId, request.getRepoUrl(), request.getBranch(), request.getCommit(),
                languages, request.getPaths(), request.getExcludePatterns());
    }

    private static Map<String, Object> metadata(EnhancementRequest request) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("repoUrl", request.getRepoUrl());
        if (hasText(request.getBranch())) {
            metadata.put("branch", request.getBranch());
        }
        if (hasText(request.getCommit())) {
            metadata.put("commit", request.getCommit());
        }
        metadata.put("dryRun", request.isDryRun());
        return metadata;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
