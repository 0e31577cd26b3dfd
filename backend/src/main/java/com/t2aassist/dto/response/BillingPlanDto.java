package com.t2aassist.dto.response;

import java.util.List;

/**
 * Response DTO for a billing plan.
 */
public record BillingPlanDto(
    long dataVersion,
    EntryDto principal,
    List<EntryDto> secondaries,
    List<EntryDto> suggestions,
    List<RejectedDto> rejected,
    double totalIcr,
    int staleReferencesSkipped,
    int retiredSkipped
) {

    public record EntryDto(
        String code,
        String label,
        double icrPublic,
        String tier,
        String reason,
        Integer supportCount,
        boolean included
    ) {}

    public record RejectedDto(
        String code,
        String tier,
        String conflictsWith
    ) {}
}
