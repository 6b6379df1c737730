package com.codegraph.core.service.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Job lifecycle: pending, running, then exactly one terminal state.
 */
public enum JobStatus {

    PENDING("pending"),
    RUNNING("running"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    JobStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
