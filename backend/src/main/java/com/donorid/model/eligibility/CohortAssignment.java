package com.donorid.model.eligibility;

import com.donorid.model.enums.CohortDefinition;
import com.donorid.model.enums.EligibilityStage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Terminal state of one hospitalization under one definition.
 *
 * @param definition     cohort definition
 * @param stageResults   result of every stage, in stage order, recorded even after exclusion
 * @param exclusionStage first failing stage, or null when included
 */
public record CohortAssignment(
    CohortDefinition definition,
    Map<EligibilityStage, Boolean> stageResults,
    EligibilityStage exclusionStage
) {

    public static final String INCLUDED = "included";

    public CohortAssignment {
        stageResults = Collections.unmodifiableMap(new LinkedHashMap<>(stageResults));
    }

    public boolean isIncluded() {
        return exclusionStage == null;
    }

    /**
     * "included" or "excluded@{stage}".
     */
    public String terminalState() {
        return isIncluded() ? INCLUDED : "excluded@" + exclusionStage.getValue();
    }

    /**
     * Per-definition eligibility flags, including the overall verdict.
     */
    public Map<String, Boolean> eligibilityFlags() {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        stageResults.forEach((stage, passed) -> flags.put(stage.getValue(), passed));
        flags.put("overall_eligible", isIncluded());
        return flags;
    }
}
