package com.donorid.dto.response;

import com.donorid.model.summary.SummaryRow;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Response DTO for a full cohort run: counts, funnels per definition, data-quality counters and the summary table.
 */
public record CohortRunDto(
    Long id,
    String siteName,
    String referenceVersion,
    LocalDateTime executedAt,
    long hospitalizationCount,
    long calcIncluded,
    long clifIncluded,
    Map<String, List<FunnelRowDto>> funnels,
    Map<String, Long> dataQuality,
    List<SummaryRow> summary
) {}
