package com.donorid.model.eligibility;

import com.donorid.model.enums.EligibilityStage;

/**
 * One row of a STROBE flow diagram.
 */
public record FunnelRow(
    int stageOrder,
    EligibilityStage stage,
    long nRemaining,
    long nDropped,
    String dropReason
) {}
