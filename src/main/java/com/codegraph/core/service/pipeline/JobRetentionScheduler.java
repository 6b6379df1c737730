package com.codegraph.core.service.pipeline;

import com.codegraph.core.service.config.RetentionConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Periodically evicts finished jobs from the registry.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobRetentionScheduler {

    private final JobRegistry jobRegistry;
    private final RetentionConfig retentionConfig;

    @Scheduled(fixedDelayString = "${codegraph.retention.job.eviction-interval-ms:60000}")
    public void evictFinishedJobs() {
        var retention = retentionConfig.getJob();
        Instant cutoff = retention.getTtlMinutes() > 0
                ? Instant.now().minus(Duration.ofMinutes(retention.getTtlMinutes()))
                : null;

        int evicted = jobRegistry.evict(cutoff, retention.getMaxCount());
        if (evicted > 0) {
            log.debug("Retention pass evicted {} jobs", evicted);
        }
    }
}
