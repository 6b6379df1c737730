package com.codegraph.core.service.pipeline;

import com.codegraph.core.service.config.MetricsConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryJobRegistryTest {

    private InMemoryJobRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryJobRegistry(new MetricsConfig(new SimpleMeterRegistry()));
        registry.init();
    }

    @Test
    @DisplayName("A job moves from pending through running to completed")
    void lifecycle() {
        registry.create(pending("job-1"));

        Job running = registry.markRunning("job-1");
        assertThat(running.status()).isEqualTo(JobStatus.RUNNING);
        assertThat(running.startedAt()).isNotNull();

        Job completed = registry.complete("job-1", Map.of("summary", Map.of("files", 2)));
        assertThat(completed.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(completed.progress()).isEqualTo(1.0);
        assertThat(completed.completedAt()).isNotNull();
        assertThat(completed.result()).containsKey("summary");
    }

    @Test
    @DisplayName("Progress is monotonic and clamped")
    void progressNeverDecreases() {
        registry.create(pending("job-1"));
        registry.markRunning("job-1");

        registry.updateProgress("job-1", 0.5, "Parsing");
        Job afterLower = registry.updateProgress("job-1", 0.2, "Still parsing");
        assertThat(afterLower.progress()).isEqualTo(0.5);
        assertThat(afterLower.progressMessage()).isEqualTo("Still parsing");

        assertThat(registry.updateProgress("job-1", 7.0, null).progress()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Terminal jobs ignore further transitions")
    void terminalStatesAreFinal() {
        registry.create(pending("job-1"));
        registry.fail("job-1", "boom");

        assertThat(registry.complete("job-1", Map.of()).status()).isEqualTo(JobStatus.FAILED);
        assertThat(registry.cancel("job-1").status()).isEqualTo(JobStatus.FAILED);
        assertThat(registry.markRunning("job-1").status()).isEqualTo(JobStatus.FAILED);
        assertThat(registry.find("job-1")).get().extracting(Job::errorMessage).isEqualTo("boom");
    }

    @Test
    @DisplayName("cancelIfPending only cancels jobs that have not started")
    void cancelIfPending() {
        registry.create(pending("waiting"));
        registry.create(pending("started"));
        registry.markRunning("started");

        assertThat(registry.cancelIfPending("waiting").status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(registry.cancelIfPending("started").status()).isEqualTo(JobStatus.RUNNING);
    }

    @Test
    void unknownJobAndDuplicateIds() {
        registry.create(pending("job-1"));

        assertThatThrownBy(() -> registry.create(pending("job-1")))
                .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> registry.markRunning("nope"))
                .isInstanceOf(PipelineException.class)
                .extracting("errorCode")
                .isEqualTo(PipelineException.JOB_NOT_FOUND);
        assertThat(registry.find("nope")).isEmpty();
    }

    @Test
    @DisplayName("Eviction removes expired and surplus terminal jobs, never active ones")
    void eviction() {
        registry.create(pending("done-1"));
        registry.complete("done-1", Map.of());
        registry.create(pending("done-2"));
        registry.fail("done-2", "boom");
        registry.create(pending("active"));
        registry.markRunning("active");

        assertThat(registry.evict(null, 2)).isEqualTo(1);
        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.find("active")).isPresent();

        assertThat(registry.evict(Instant.now().plusSeconds(60), 100)).isEqualTo(1);
        assertThat(registry.list()).extracting(Job::id).containsExactly("active");

        assertThat(registry.evict(null, 0)).isZero();
    }

    @Test
    @DisplayName("Concurrent readers always see monotonic progress")
    void concurrentReadsSeeConsistentSnapshots() throws Exception {
        registry.create(pending("job-1"));
        registry.markRunning("job-1");
        ExecutorService readers = Executors.newFixedThreadPool(4);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int r = 0; r < 4; r++) {
                results.add(readers.submit(() -> {
                    double last = 0.0;
                    for (int i = 0; i < 2_000; i++) {
                        Job snapshot = registry.find("job-1").orElseThrow();
                        if (snapshot.progress() < last) {
                            return false;
                        }
                        last = snapshot.progress();
                    }
                    return true;
                }));
            }
            for (int step = 1; step <= 1_000; step++) {
                registry.updateProgress("job-1", step / 1_000.0, "step " + step);
            }
            for (Future<Boolean> result : results) {
                assertThat(result.get(10, TimeUnit.SECONDS)).isTrue();
            }
        } finally {
            readers.shutdownNow();
        }
        assertThat(registry.find("job-1")).get().extracting(Job::progress).isEqualTo(1.0);
    }

    private static Job pending(String id) {
        return Job.pending(id, JobKind.ENHANCEMENT, "repo-1", Map.of());
    }
}
