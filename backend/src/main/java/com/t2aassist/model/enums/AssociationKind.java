package com.t2aassist.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of an official ATIH association.
 */
public enum AssociationKind {
    COMPLEMENTARY_GESTURE("complementary_gesture"),
    COMPLEMENTARY_ANESTHESIA("complementary_anesthesia");

    private final String value;

    AssociationKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static AssociationKind fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (AssociationKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown AssociationKind: " + value);
    }
}
