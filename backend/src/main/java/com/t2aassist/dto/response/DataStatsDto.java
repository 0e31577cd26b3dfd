package com.t2aassist.dto.response;

import java.time.Instant;
import java.util.Map;

/**
 * Response DTO for reference data statistics.
 */
public record DataStatsDto(
    String versionLabel,
    long dataVersion,
    Instant loadedAt,
    int activeCodes,
    int retiredCodes,
    Map<String, Long> pairsByTier,
    long staleReferencesSkipped,
    Map<String, Long> hitsByStage
) {}
