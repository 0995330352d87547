package com.donorid.dto.response;

/**
 * One flow diagram row.
 */
public record FunnelRowDto(
    int stageOrder,
    String stage,
    long nRemaining,
    long nDropped,
    String dropReason
) {}
