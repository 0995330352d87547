package com.donorid.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Diagnosis groupings matched against the ICD-10-CM reference ranges.
 */
public enum DiagnosisCategory {
    ISCHEMIC_HEART("ischemic_heart", true),
    CEREBROVASCULAR("cerebrovascular", true),
    EXTERNAL_CAUSE("external_cause", true),
    SEPSIS("sepsis", false),
    ACTIVE_CANCER("active_cancer", false);

    private final String value;
    private final boolean qualifyingCause;

    DiagnosisCategory(String value, boolean qualifyingCause) {
        this.value = value;
        this.qualifyingCause = qualifyingCause;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * True for the CMS cause-of-death groups, false for contraindications.
     */
    public boolean isQualifyingCause() {
        return qualifyingCause;
    }

    public static DiagnosisCategory fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (DiagnosisCategory category : values()) {
            if (category.value.equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown DiagnosisCategory: " + value);
    }
}
