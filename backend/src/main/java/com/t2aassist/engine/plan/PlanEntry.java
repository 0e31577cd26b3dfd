package com.t2aassist.engine.plan;

import com.t2aassist.engine.catalog.CatalogCode;
import com.t2aassist.model.enums.AssociationTier;
import com.t2aassist.model.enums.InclusionReason;

/**
 * One line of a billing plan.
 *
 * @param tier         confidence badge; null for the principal
 * @param reason       source that justified the line; null for the principal
 * @param supportCount observations behind the pair, when frequency data has any
 * @param included     whether the line counts toward the plan total
 */
public record PlanEntry(
    CatalogCode code,
    AssociationTier tier,
    InclusionReason reason,
    Integer supportCount,
    boolean principal,
    boolean included
) {

    static PlanEntry principal(CatalogCode code) {
        return new PlanEntry(code, null, null, null, true, true);
    }

    public String codeId() {
        return code.id();
    }

    public double workValue() {
        return code.workValue();
    }

    PlanEntry withIncluded(boolean value) {
        return new PlanEntry(code, tier, reason, supportCount, principal, value);
    }
}
