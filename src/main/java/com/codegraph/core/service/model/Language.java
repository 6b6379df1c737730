package com.codegraph.core.service.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Source languages recognised by the indexer.
 */
public enum Language {

    PYTHON("python"),
    TYPESCRIPT("typescript"),
    JAVASCRIPT("javascript"),
    JAVA("java"),
    GO("go"),
    RUST("rust"),
    C("c"),
    CPP("cpp"),
    CSHARP("csharp");

    private final String value;

    Language(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static Language fromValue(String value) {
        return find(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown language: " + value));
    }

    public static Optional<Language> find(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(language -> language.value.equals(normalized))
                .findFirst();
    }
}
