package com.codegraph.core.service.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A typed, directed relationship between two symbols.
 *
 * When {@code targetId} is null the target is an external or not yet resolved reference,
 * described by the attributes (for example {@code module} for imports or {@code callee}
 * for calls whose target lives in another file).
 */
@Builder(toBuilder = true)
public record Edge(
        String id,
        String repoId,
        String sourceId,
        String targetId,
        EdgeKind kind,
        Map<String, Object> attributes
) {

    public static final String ATTR_MODULE = "module";
    public static final String ATTR_NAME = "name";
    public static final String ATTR_CALLEE = "callee";
    public static final String ATTR_CALLEE_KIND = "callee_kind";
    public static final String ATTR_LINE = "line";
    public static final String ATTR_COLUMN = "column";

    public Edge {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(kind, "kind");
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    @JsonIgnore
    public boolean isResolved() {
        return targetId != null;
    }

    public Integer siteLine() {
        return intAttribute(ATTR_LINE);
    }

    public Integer siteColumn() {
        return intAttribute(ATTR_COLUMN);
    }

    private Integer intAttribute(String key) {
        Object value = attributes.get(key);
        return value instanceof Number number ? number.intValue() : null;
    }
}
