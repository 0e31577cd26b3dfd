package com.t2aassist.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Confidence of a code pair, as resolved by the tier-merge policy.
 *
 * The four compatibility tiers carry a positive trust; {@link #UNKNOWN} is an
 * unrecorded pair and {@link #INCOMPATIBLE} a hard exclusion.
 */
public enum AssociationTier {
    VERIFIED("verified", 4),
    OFFICIAL("official", 3),
    SAME_REGION("same_region", 2),
    CROSS_REGION("cross_region", 1),
    UNKNOWN("unknown", 0),
    INCOMPATIBLE("incompatible", -1);

    private final String value;
    private final int trust;

    AssociationTier(String value, int trust) {
        this.value = value;
        this.trust = trust;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getTrust() {
        return trust;
    }

    /**
     * True for the four tiers that may be suggested without a user override.
     */
    public boolean isCompatible() {
        return trust > 0;
    }

    public boolean isAtLeast(AssociationTier other) {
        return trust >= other.trust;
    }

    public static AssociationTier fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (AssociationTier tier : values()) {
            if (tier.value.equalsIgnoreCase(value)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown AssociationTier: " + value);
    }
}
