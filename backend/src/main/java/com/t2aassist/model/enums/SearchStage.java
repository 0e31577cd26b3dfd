package com.t2aassist.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stages of the cascading code search, in the order they are tried.
 */
public enum SearchStage {
    CONJUNCTIVE("conjunctive"),
    DISJUNCTIVE("disjunctive"),
    SUBSTRING("substring");

    private final String value;

    SearchStage(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
