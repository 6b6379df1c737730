package com.codegraph.core.service.pipeline;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobKind {

    ENHANCEMENT("enhancement");

    private final String value;

    JobKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
