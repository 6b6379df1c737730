package com.codegraph.core.service.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kinds of directed relationships between symbols.
 *
 * Only {@link #CONTAINS} is required to be acyclic (class to method within one file);
 * every other kind may form cycles.
 */
public enum EdgeKind {

    CONTAINS("contains"),
    CALLS("calls"),
    IMPORTS("imports"),
    INHERITS("inherits"),
    IMPLEMENTS("implements"),
    REFERENCES("references"),
    DEFINES("defines"),
    USES("uses"),
    DEPENDS_ON("depends_on"),
    INSTANTIATES("instantiates"),
    THROWS("throws"),
    CATCHES("catches"),
    OVERRIDES("overrides"),
    EXTENDS("extends");

    private final String value;

    EdgeKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static EdgeKind fromValue(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown edge kind: " + value));
    }
}
