package com.t2aassist.engine.plan;

import com.t2aassist.model.enums.AssociationTier;

/**
 * A candidate left out of the plan because it clashes with a code already in it.
 */
public record RejectedCandidate(String codeId, AssociationTier tier, String conflictsWith) {
}
