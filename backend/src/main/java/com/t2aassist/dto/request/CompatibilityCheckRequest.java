package com.t2aassist.dto.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for checking a hand-picked set of codes.
 */
public record CompatibilityCheckRequest(
    @NotNull(message = "Codes are required")
    @Size(min = 2, message = "At least 2 codes are required")
    List<String> codes
) {}
