package com.codegraph.core.service.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named code entity extracted from one source file.
 *
 * The parent reference is an id lookup only (a method points at its enclosing class);
 * it carries no ownership.
 */
@Builder(toBuilder = true)
public record Symbol(
        String id,
        String repoId,
        String name,
        SymbolKind kind,
        String filePath,
        Language language,
        SourceSpan span,
        String docstring,
        String signature,
        String parentId,
        Map<String, Object> attributes
) {

    public static final String ATTR_PARAMETERS = "parameters";
    public static final String ATTR_SUPERCLASSES = "superclasses";

    public Symbol {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(span, "span");
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Parameter names recorded by the extractor, empty when none were recorded.
     */
    public List<String> parameterNames() {
        return stringList(ATTR_PARAMETERS);
    }

    public List<String> superclassNames() {
        return stringList(ATTR_SUPERCLASSES);
    }

    public boolean hasParent() {
        return parentId != null;
    }

    private List<String> stringList(String key) {
        Object value = attributes.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return List.of();
    }
}
