package com.donorid.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lab categories that gate organ quality. All thresholds on them are upper bounds.
 */
public enum LabCategory {
    CREATININE("creatinine"),
    BILIRUBIN_TOTAL("bilirubin_total"),
    AST("ast"),
    ALT("alt");

    private final String value;

    LabCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static LabCategory fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (LabCategory category : values()) {
            if (category.value.equalsIgnoreCase(value.trim())) {
                return category;
            }
        }
        return null; // Other lab categories are ignored
    }
}
