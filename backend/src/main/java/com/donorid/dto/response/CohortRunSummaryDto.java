package com.donorid.dto.response;

import java.time.LocalDateTime;

/**
 * Response DTO for the run list view.
 */
public record CohortRunSummaryDto(
    Long id,
    String siteName,
    String referenceVersion,
    LocalDateTime executedAt,
    long hospitalizationCount,
    long calcIncluded,
    long clifIncluded
) {}
