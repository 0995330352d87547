package com.donorid.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Non-fatal data problems counted during a run.
 */
public enum DataQualityIssue {
    MISSING_TIMESTAMP("missing_timestamp"),
    MISSING_REQUIRED_FIELD("missing_required_field"),
    UNKNOWN_CODE_FORMAT("unknown_code_format"),
    IMPLAUSIBLE_VALUE("implausible_value");

    private final String value;

    DataQualityIssue(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
