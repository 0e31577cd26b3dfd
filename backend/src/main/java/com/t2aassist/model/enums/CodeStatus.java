package com.t2aassist.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of a CCAM code. Retired codes keep their identifier.
 */
public enum CodeStatus {
    ACTIVE("active"),
    RETIRED("retired");

    private final String value;

    CodeStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static CodeStatus fromValue(String value) {
        for (CodeStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown CodeStatus: " + value);
    }
}
