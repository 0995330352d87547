package com.donorid.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Inclusion stages shared by the cohort definitions.
 * The drop reason is the label written to the funnel for hospitalizations excluded at the stage.
 */
public enum EligibilityStage {
    EXPIRED("expired", "not an inpatient death"),
    DEATH_TIME_KNOWN("death_time_known", "missing death time"),
    LOCATION("location_eligible", "death outside ed, ward, stepdown or icu"),
    AGE("age_eligible", "age over 75 or unknown"),
    CAUSE("cause_eligible", "no qualifying cause of death"),
    IMV("imv_eligible", "no invasive ventilation within 48h of death"),
    NO_CONTRAINDICATION("no_contraindication", "medical contraindication"),
    ORGAN_QUALITY("organ_quality_eligible", "failed organ quality check");

    private final String value;
    private final String dropReason;

    EligibilityStage(String value, String dropReason) {
        this.value = value;
        this.dropReason = dropReason;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDropReason() {
        return dropReason;
    }

    public static EligibilityStage fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (EligibilityStage stage : values()) {
            if (stage.value.equalsIgnoreCase(value)) {
                return stage;
            }
        }
        throw new IllegalArgumentException("Unknown EligibilityStage: " + value);
    }
}
