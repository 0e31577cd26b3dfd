package com.t2aassist.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a search returned what it returned. Searches never throw on bad input.
 */
public enum SearchReason {
    MATCHED("matched"),
    EMPTY_QUERY("empty_query"),
    NO_MATCH("no_match"),
    INVALID_LIMIT("invalid_limit"),
    DATA_VERSION_MISMATCH("data_version_mismatch");

    private final String value;

    SearchReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
