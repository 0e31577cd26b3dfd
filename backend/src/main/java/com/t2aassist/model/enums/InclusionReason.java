package com.t2aassist.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which source justified adding a secondary code to a billing plan.
 */
public enum InclusionReason {
    OFFICIAL_GESTURE_CONFIRMED("official_gesture_confirmed"),
    OFFICIAL_ANESTHESIA_CONFIRMED("official_anesthesia_confirmed"),
    OFFICIAL_GESTURE("official_gesture"),
    OFFICIAL_ANESTHESIA("official_anesthesia"),
    OBSERVED_SAME_REGION("observed_same_region"),
    OBSERVED_CROSS_REGION("observed_cross_region"),
    USER_FORCED("user_forced"),
    LINKED_TO_SECONDARY("linked_to_secondary");

    private final String value;

    InclusionReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Derive the reason from the resolved tier and, for official tiers, the association kind.
     */
    public static InclusionReason of(AssociationTier tier, AssociationKind kind) {
        boolean anesthesia = kind == AssociationKind.COMPLEMENTARY_ANESTHESIA;
        return switch (tier) {
            case VERIFIED -> anesthesia ? OFFICIAL_ANESTHESIA_CONFIRMED : OFFICIAL_GESTURE_CONFIRMED;
            case OFFICIAL -> anesthesia ? OFFICIAL_ANESTHESIA : OFFICIAL_GESTURE;
            case SAME_REGION -> OBSERVED_SAME_REGION;
            case CROSS_REGION -> OBSERVED_CROSS_REGION;
            case UNKNOWN -> USER_FORCED;
            case INCOMPATIBLE -> throw new IllegalArgumentException("Incompatible pairs are never included");
        };
    }
}
