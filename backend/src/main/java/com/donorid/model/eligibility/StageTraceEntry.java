package com.donorid.model.eligibility;

import com.donorid.model.enums.EligibilityStage;

/**
 * Cohort size across one stage transition.
 */
public record StageTraceEntry(
    EligibilityStage stage,
    long cohortSizeBefore,
    long cohortSizeAfter,
    long excludedCount,
    String exclusionReason
) {

    public StageTraceEntry {
        if (cohortSizeBefore - cohortSizeAfter != excludedCount) {
            throw new IllegalArgumentException("Stage " + stage + ": " + cohortSizeBefore + " - "
                + cohortSizeAfter + " != " + excludedCount);
        }
    }
}
