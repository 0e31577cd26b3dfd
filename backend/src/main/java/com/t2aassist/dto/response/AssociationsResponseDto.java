package com.t2aassist.dto.response;

import java.util.List;

/**
 * Response DTO listing the codes associated with one code.
 */
public record AssociationsResponseDto(
    String code,
    int count,
    List<AssociationDto> associations
) {

    /**
     * {@code label} and {@code icrPublic} are null when the associated code is missing from the catalog.
     */
    public record AssociationDto(
        String code,
        String label,
        Double icrPublic,
        String tier,
        Integer supportCount,
        String officialKind
    ) {}
}
