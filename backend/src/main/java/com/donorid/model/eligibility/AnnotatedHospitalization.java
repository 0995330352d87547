package com.donorid.model.eligibility;

import com.donorid.model.enums.CohortDefinition;
import com.donorid.model.feature.FeatureRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * A hospitalization with its features, criterion flags and per-definition outcome.
 */
public record AnnotatedHospitalization(
    FeatureRecord features,
    CriterionFlags flags,
    Map<CohortDefinition, CohortAssignment> assignments
) {

    public AnnotatedHospitalization {
        assignments = Collections.unmodifiableMap(new EnumMap<>(assignments));
    }

    public String hospitalizationId() {
        return features.hospitalizationId();
    }

    public boolean isIncluded(CohortDefinition definition) {
        CohortAssignment assignment = assignments.get(definition);
        return assignment != null && assignment.isIncluded();
    }
}
