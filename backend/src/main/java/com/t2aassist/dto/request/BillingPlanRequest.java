package com.t2aassist.dto.request;

import jakarta.validation.constraints.NotBlank;

import java.util.List;

/**
 * Request DTO for building a billing plan with user overrides.
 */
public record BillingPlanRequest(
    @NotBlank(message = "Principal code is required")
    String principal,

    List<String> exclude,

    List<String> force
) {}
