package com.codegraph.core.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for job retention and eviction.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "codegraph.retention")
public class RetentionConfig {

    /**
     * Job retention settings.
     */
    private JobRetention job = new JobRetention();

    @Getter
    @Setter
    public static class JobRetention {

        /**
         * TTL for finished jobs in minutes (0 = no automatic eviction).
         */
        private long ttlMinutes = 60;

        /**
         * Maximum number of jobs to keep in memory.
         */
        private int maxCount = 1000;

        /**
         * Eviction check interval in milliseconds.
         */
        private long evictionIntervalMs = 60000; // 1 minute
    }
}
