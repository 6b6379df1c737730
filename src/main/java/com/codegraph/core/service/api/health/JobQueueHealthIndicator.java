package com.codegraph.core.service.api.health;

import com.codegraph.core.service.config.PipelineConfig;
import com.codegraph.core.service.pipeline.JobQueue;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the job queue.
 *
 * Reports DOWN once utilization reaches the backpressure threshold.
 */
@Component
@RequiredArgsConstructor
public class JobQueueHealthIndicator implements HealthIndicator {

    private final JobQueue queue;
    private final PipelineConfig config;

    @Override
    public Health health() {
        int utilization = queue.getUtilizationPercent();
        int threshold = config.getQueue().getBackpressureThreshold();

        Health.Builder builder = utilization >= threshold
                ? Health.down()
                : Health.up();

        return builder
                .withDetail("queueSize", queue.size())
                .withDetail("queueCapacity", queue.getCapacity())
                .withDetail("utilizationPercent", utilization)
                .withDetail("backpressureThreshold", threshold)
                .withDetail("isFull", queue.isFull())
                .build();
    }
}
