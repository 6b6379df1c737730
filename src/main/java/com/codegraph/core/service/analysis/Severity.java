package com.codegraph.core.service.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Severity of a finding, in ascending order.
 */
public enum Severity {

    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String value;

    Severity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
