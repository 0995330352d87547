package com.donorid.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * ADT location categories.
 */
public enum LocationCategory {
    ED("ed", true),
    WARD("ward", true),
    STEPDOWN("stepdown", true),
    ICU("icu", true),
    PROCEDURAL("procedural", false),
    LABOR_AND_DELIVERY("l&d", false),
    HOSPICE("hospice", false),
    PSYCH("psych", false),
    RADIOLOGY("radiology", false),
    DIALYSIS("dialysis", false),
    OTHER("other", false);

    private final String value;
    private final boolean inpatientDeathLocation;

    LocationCategory(String value, boolean inpatientDeathLocation) {
        this.value = value;
        this.inpatientDeathLocation = inpatientDeathLocation;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Locations where a death counts for the CLIF definition.
     */
    public boolean isInpatientDeathLocation() {
        return inpatientDeathLocation;
    }

    public static LocationCategory fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (LocationCategory category : values()) {
            if (category.value.equalsIgnoreCase(value.trim())) {
                return category;
            }
        }
        return OTHER;
    }
}
