package com.codegraph.core.service.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of one pipeline execution.
 *
 * The registry replaces snapshots atomically; readers always see a consistent view.
 */
@Builder(toBuilder = true)
public record Job(
        String id,
        JobKind kind,
        String repoId,
        JobStatus status,
        double progress,
        String progressMessage,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String errorMessage,
        Map<String, Object> result,
        Map<String, Object> metadata
) {

    public Job {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        if (progress < 0.0 || progress > 1.0) {
            throw new IllegalArgumentException("Progress must be within [0, 1]: " + progress);
        }
        result = result == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(result));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Job pending(String id, JobKind kind, String repoId, Map<String, Object> metadata) {
        return Job.builder()
                .id(id)
                .kind(kind)
                .repoId(repoId)
                .status(JobStatus.PENDING)
                .progress(0.0)
                .createdAt(Instant.now())
                .metadata(metadata)
                .build();
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }
}
