package com.codegraph.core.service.analysis;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FindingType {

    BUG("bug"),
    SECURITY("security"),
    PERFORMANCE("performance"),
    MAINTAINABILITY("maintainability"),
    RELIABILITY("reliability"),
    STYLE("style"),
    ARCHITECTURE("architecture");

    private final String value;

    FindingType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
