package com.donorid.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Bedside assessments carried for descriptive statistics only.
 */
public enum AssessmentCategory {
    GCS_TOTAL("gcs_total"),
    RASS("rass");

    private final String value;

    AssessmentCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static AssessmentCategory fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (AssessmentCategory category : values()) {
            if (category.value.equalsIgnoreCase(value.trim())) {
                return category;
            }
        }
        return null;
    }
}
