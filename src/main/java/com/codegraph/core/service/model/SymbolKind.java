package com.codegraph.core.service.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Kinds of named code entities.
 */
public enum SymbolKind {

    FUNCTION("function"),
    METHOD("method"),
    CLASS("class"),
    INTERFACE("interface"),
    VARIABLE("variable"),
    CONSTANT("constant"),
    MODULE("module"),
    PACKAGE("package"),
    PARAMETER("parameter"),
    TYPE("type"),
    ENUM("enum"),
    STRUCT("struct"),
    TRAIT("trait");

    private final String value;

    SymbolKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether symbols of this kind can appear as caller or callee of a call edge.
     */
    public boolean isCallable() {
        return this == FUNCTION || this == METHOD;
    }

    @JsonCreator
    public static SymbolKind fromValue(String value) {
        return Arrays.stream(values())
                .filter(kind -> kind.value.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown symbol kind: " + value));
    }
}
