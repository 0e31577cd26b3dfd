package com.t2aassist.dto.response;

import java.time.LocalDate;

/**
 * Response DTO for a CCAM code with its details.
 */
public record CodeDto(
    String code,
    String label,
    String description,
    double icrPublic,
    Double icrPrivate,
    String status,
    String chapter,
    String chapterTitle,
    String paragraphTitle,
    String activity,
    String classant,
    String codingInstruction,
    LocalDate dateEnd,
    int associationCount
) {}
