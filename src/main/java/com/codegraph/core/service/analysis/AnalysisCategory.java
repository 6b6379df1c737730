package com.codegraph.core.service.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Result groups of the analysis stage, run in declaration order.
 */
public enum AnalysisCategory {

    STATIC("static"),
    DYNAMIC("dynamic"),
    MUTATION("mutation");

    private final String value;

    AnalysisCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
