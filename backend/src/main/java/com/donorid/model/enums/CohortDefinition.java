package com.donorid.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Potential donor definitions evaluated for every hospitalization.
 * Each definition owns an ordered list of eligibility stages.
 */
public enum CohortDefinition {
    CALC("calc", List.of(
        EligibilityStage.EXPIRED,
        EligibilityStage.DEATH_TIME_KNOWN,
        EligibilityStage.AGE,
        EligibilityStage.CAUSE,
        EligibilityStage.NO_CONTRAINDICATION
    )),
    CLIF("clif", List.of(
        EligibilityStage.EXPIRED,
        EligibilityStage.DEATH_TIME_KNOWN,
        EligibilityStage.LOCATION,
        EligibilityStage.AGE,
        EligibilityStage.IMV,
        EligibilityStage.NO_CONTRAINDICATION,
        EligibilityStage.ORGAN_QUALITY
    ));

    private final String value;
    private final List<EligibilityStage> stages;

    CohortDefinition(String value, List<EligibilityStage> stages) {
        this.value = value;
        this.stages = stages;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Stages in evaluation order. A hospitalization leaves the cohort at the first failing stage.
     */
    public List<EligibilityStage> getStages() {
        return stages;
    }

    public static CohortDefinition fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (CohortDefinition definition : values()) {
            if (definition.value.equalsIgnoreCase(value)) {
                return definition;
            }
        }
        throw new IllegalArgumentException("Unknown CohortDefinition: " + value);
    }
}
