package com.donorid.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Vital sign categories used for BMI.
 */
public enum VitalCategory {
    WEIGHT_KG("weight_kg"),
    HEIGHT_CM("height_cm");

    private final String value;

    VitalCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static VitalCategory fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (VitalCategory category : values()) {
            if (category.value.equalsIgnoreCase(value.trim())) {
                return category;
            }
        }
        return null;
    }
}
