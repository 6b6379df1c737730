package com.codegraph.core.service.analysis;

import lombok.Builder;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One analysis result, optionally anchored to a file range and a symbol.
 */
@Builder(toBuilder = true)
public record Finding(
        String id,
        String repoId,
        FindingType type,
        Severity severity,
        String title,
        String description,
        String filePath,
        Integer startLine,
        Integer endLine,
        String symbolId,
        String ruleId,
        Map<String, Object> metadata
) {

    public Finding {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(title, "title");
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Stable id for a rule hit, so re-running an analysis reports the same finding ids.
     */
    public static String idFor(String repoId, String ruleId, String subject) {
        String key = repoId + "\u0000" + ruleId + "\u0000" + subject;
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)).toString();
    }
}
