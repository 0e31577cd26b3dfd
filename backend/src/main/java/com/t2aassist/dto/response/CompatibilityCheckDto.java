package com.t2aassist.dto.response;

import java.util.List;

/**
 * Response DTO for a compatibility check over user-selected codes.
 */
public record CompatibilityCheckDto(
    List<String> codes,
    List<IssueDto> issues
) {

    public record IssueDto(
        String type,
        List<String> codes,
        String tier,
        String message
    ) {}
}
