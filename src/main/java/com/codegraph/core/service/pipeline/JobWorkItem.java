package com.codegraph.core.service.pipeline;

import com.codegraph.core.service.ingest.RepoSpec;

import java.time.Instant;

/**
 * Queued request to run the enhancement pipeline for a registered job.
 */
public record JobWorkItem(
        String jobId,
        RepoSpec repoSpec,
        boolean dryRun,
        Instant createdAt
) {

    public JobWorkItem(String jobId, RepoSpec repoSpec, boolean dryRun) {
        this(jobId, repoSpec, dryRun, Instant.now());
    }
}
