package com.codegraph.core.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the CodeGraph service.
 *
 * Provides custom metrics for jobs, extraction and graph writes.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter jobsSubmitted;
    private final Counter jobsCompleted;
    private final Counter jobsFailed;
    private final Counter jobsCancelled;
    private final Counter symbolsWritten;
    private final Counter edgesWritten;
    private final Counter extractionFailures;

    // Timers
    private final Timer jobTimer;
    private final Timer extractionTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        // Initialize counters
        this.jobsSubmitted = Counter.builder("codegraph.jobs.submitted")
                .description("Number of jobs accepted")
                .register(registry);

        this.jobsCompleted = Counter.builder("codegraph.jobs.completed")
                .description("Number of jobs completed")
                .register(registry);

        this.jobsFailed = Counter.builder("codegraph.jobs.failed")
                .description("Number of jobs failed")
                .register(registry);

        this.jobsCancelled = Counter.builder("codegraph.jobs.cancelled")
                .description("Number of jobs cancelled")
                .register(registry);

        this.symbolsWritten = Counter.builder("codegraph.graph.symbols.written")
                .description("Number of symbols upserted")
                .register(registry);

        this.edgesWritten = Counter.builder("codegraph.graph.edges.written")
                .description("Number of edges upserted")
                .register(registry);

        this.extractionFailures = Counter.builder("codegraph.extract.failures")
                .description("Number of files that failed to parse or extract")
                .register(registry);

        // Initialize timers
        this.jobTimer = Timer.builder("codegraph.jobs.duration")
                .description("Time taken to run a job")
                .register(registry);

        this.extractionTimer = Timer.builder("codegraph.extract.duration")
                .description("Time taken to parse and extract one file")
                .register(registry);
    }

    /**
     * Registers a gauge for queue depth monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerQueueGauge(String name, String description, Supplier<Number> sizeSupplier) {
        registerGauge(name, description, sizeSupplier);
    }

    /**
     * Registers a gauge for registry size monitoring.
     */
    public void registerRegistryGauge(String name, String description, Supplier<Number> sizeSupplier) {
        registerGauge(name, description, sizeSupplier);
    }

    private void registerGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }
}
