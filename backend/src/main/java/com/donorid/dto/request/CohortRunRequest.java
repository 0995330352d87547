package com.donorid.dto.request;

import jakarta.validation.constraints.Size;

/**
 * Request DTO for starting a cohort run. An absent site name falls back to the configured one.
 */
public record CohortRunRequest(
    @Size(max = 255, message = "Site name must be at most 255 characters")
    String siteName
) {}
