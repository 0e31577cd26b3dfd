package com.t2aassist.engine.graph;

import com.t2aassist.model.enums.AssociationKind;
import com.t2aassist.model.enums.AssociationTier;

/**
 * Resolved compatibility between two codes.
 *
 * @param supportCount observation count, null when the pair has no frequency record
 * @param officialKind kind of the official record, null when the pair has none
 */
public record Association(CodePair pair, AssociationTier tier, Integer supportCount, AssociationKind officialKind) {

    public Association {
        if (!tier.isCompatible()) {
            throw new IllegalArgumentException("Associations only hold compatibility tiers, got " + tier);
        }
    }
}
