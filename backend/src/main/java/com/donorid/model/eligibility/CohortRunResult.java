package com.donorid.model.eligibility;

import com.donorid.model.enums.CohortDefinition;
import com.donorid.model.enums.DataQualityIssue;
import com.donorid.model.summary.SummaryRow;

import java.util.List;
import java.util.Map;

/**
 * Everything one engine run produces for the reporting layer.
 */
public record CohortRunResult(
    String siteName,
    String referenceVersion,
    List<AnnotatedHospitalization> hospitalizations,
    Map<CohortDefinition, StageTrace> stageTraces,
    Map<CohortDefinition, List<FunnelRow>> funnels,
    Map<DataQualityIssue, Long> dataQuality,
    List<SummaryRow> summary
) {

    public long includedCount(CohortDefinition definition) {
        return hospitalizations.stream().filter(h -> h.isIncluded(definition)).count();
    }
}
