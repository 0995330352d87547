package com.donorid.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Diagnosis code systems the classifier understands.
 */
public enum DiagnosisCodeFormat {
    ICD10("icd10"),
    ICD10CM("icd10cm");

    private final String value;

    DiagnosisCodeFormat(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Lookup tolerant of case and punctuation ("ICD-10-CM" matches icd10cm).
     * Unknown formats are not an error: they return null and the row is skipped.
     */
    public static DiagnosisCodeFormat fromValue(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "");
        for (DiagnosisCodeFormat format : values()) {
            if (format.value.equals(normalized)) {
                return format;
            }
        }
        return null;
    }
}
