package com.t2aassist.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Findings of a compatibility check over a user-chosen set of codes.
 */
public enum IssueType {
    OK("ok"),
    UNKNOWN_CODE("unknown_code"),
    RETIRED_CODE("retired_code"),
    INCOMPATIBLE_PAIR("incompatible_pair"),
    KNOWN_ASSOCIATION("known_association");

    private final String value;

    IssueType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
