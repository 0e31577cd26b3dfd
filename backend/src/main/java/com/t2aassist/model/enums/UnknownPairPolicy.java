package com.t2aassist.model.enums;

/**
 * What the plan assembler does with codes whose pair with the principal is unrecorded.
 */
public enum UnknownPairPolicy {
    /** Never shown unless the user forces them. */
    HIDE,
    /** Returned as low-confidence suggestions, outside the plan and its total. */
    SUGGEST
}
