package com.t2aassist.engine.graph;

import com.t2aassist.model.enums.AssociationKind;
import com.t2aassist.model.enums.AssociationTier;

/**
 * A code linked to a given code, seen from that code's side.
 */
public record Neighbor(String codeId, AssociationTier tier, Integer supportCount, AssociationKind officialKind) {

    static Neighbor from(String self, Association association) {
        return new Neighbor(association.pair().other(self), association.tier(),
            association.supportCount(), association.officialKind());
    }
}
