package com.t2aassist.dto.response;

import java.util.List;

/**
 * Response DTO for a code search.
 * {@code stage} is null and {@code reason} explains why when nothing matched.
 */
public record SearchResponseDto(
    String query,
    String normalizedQuery,
    String stage,
    String reason,
    int count,
    long dataVersion,
    List<HitDto> results
) {

    public record HitDto(
        String code,
        String label,
        double icrPublic,
        String status,
        String chapterTitle,
        String paragraphTitle,
        double score,
        int associationCount
    ) {}
}
