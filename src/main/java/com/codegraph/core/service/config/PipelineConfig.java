package com.codegraph.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the enhancement pipeline.
 *
 * Controls the job queue, worker pool, extraction parallelism and file limits.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "codegraph.pipeline")
public class PipelineConfig {

    /**
     * Queue configuration.
     */
    private QueueConfig queue = new QueueConfig();

    /**
     * Worker configuration.
     */
    private WorkerConfig worker = new WorkerConfig();

    /**
     * Number of threads used to parse and extract files of one job.
     */
    private int extractionParallelism = 4;

    /**
     * Files larger than this are skipped by the indexer (default: 10 MB).
     */
    private long maxFileSizeBytes = 10L * 1024 * 1024;

    /**
     * Directory under which repositories are cloned; blank uses the system temp directory.
     */
    private String workspaceDir = "";

    /**
     * Number of findings turned into change proposals.
     */
    private int maxProposals = 5;

    /**
     * Timeout for cloning a repository in seconds.
     */
    private int cloneTimeoutSeconds = 300;

    @Getter
    @Setter
    public static class QueueConfig {

        /**
         * Maximum number of queued jobs.
         */
        private int capacity = 100;

        /**
         * Queue utilization threshold for backpressure alerts (percentage).
         */
        private int backpressureThreshold = 80;
    }

    @Getter
    @Setter
    public static class WorkerConfig {

        /**
         * Number of worker threads running jobs.
         */
        private int threadCount = 2;

        /**
         * Poll timeout in milliseconds.
         */
        private long pollMs = 100;

        /**
         * Time to wait for running jobs on shutdown in seconds.
         */
        private int shutdownTimeoutSeconds = 30;
    }
}
