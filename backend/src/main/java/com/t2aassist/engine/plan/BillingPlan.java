package com.t2aassist.engine.plan;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Billing plan rooted at one principal code.
 *
 * Secondaries are in acceptance order: tier trust descending, work value descending,
 * identifier ascending. Every pair of entries is compatible, so toggling an entry only
 * moves the total by that entry's own work value.
 *
 * @param suggestions    low-confidence codes shown next to the plan, never counted in the total
 * @param staleReferences association targets missing from the catalog that were skipped
 * @param retiredSkipped  retired association targets that were skipped
 */
public record BillingPlan(
    long dataVersion,
    PlanEntry principal,
    List<PlanEntry> secondaries,
    List<RejectedCandidate> rejected,
    List<PlanEntry> suggestions,
    int staleReferences,
    int retiredSkipped,
    double totalWorkValue
) {

    public BillingPlan {
        secondaries = List.copyOf(secondaries);
        rejected = List.copyOf(rejected);
        suggestions = List.copyOf(suggestions);
    }

    /**
     * Principal first, then secondaries.
     */
    public List<PlanEntry> entries() {
        return Stream.concat(Stream.of(principal), secondaries.stream()).toList();
    }

    public List<String> includedCodes() {
        return entries().stream().filter(PlanEntry::included).map(PlanEntry::codeId).toList();
    }

    /**
     * Principal work value plus the included secondaries, summed in plan order.
     */
    static double totalOf(PlanEntry principal, List<PlanEntry> secondaries) {
        double total = principal.workValue();
        for (PlanEntry entry : secondaries) {
            if (entry.included()) {
                total += entry.workValue();
            }
        }
        return total;
    }

    /**
     * Switch a secondary on or off. The total is recomputed from the included entries.
     *
     * @throws IllegalArgumentException for the principal or a code that is not a secondary
     */
    public BillingPlan withIncluded(String codeId, boolean included) {
        if (principal.codeId().equalsIgnoreCase(codeId)) {
            throw new IllegalArgumentException("The principal code cannot be toggled: " + codeId);
        }
        List<PlanEntry> updated = new ArrayList<>(secondaries);
        for (int i = 0; i < updated.size(); i++) {
            PlanEntry entry = updated.get(i);
            if (!entry.codeId().equalsIgnoreCase(codeId)) {
                continue;
            }
            if (entry.included() == included) {
                return this;
            }
            updated.set(i, entry.withIncluded(included));
            return new BillingPlan(dataVersion, principal, updated, rejected, suggestions,
                staleReferences, retiredSkipped, totalOf(principal, updated));
        }
        throw new IllegalArgumentException("Code " + codeId + " is not a secondary of this plan");
    }
}
