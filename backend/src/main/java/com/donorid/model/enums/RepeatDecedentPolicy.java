package com.donorid.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How patients with more than one expired encounter enter the run.
 */
public enum RepeatDecedentPolicy {
    /** Every expired encounter is evaluated on its own. */
    EVALUATE_ALL("evaluate-all"),
    /** Only the encounter with the latest discharge is kept; earlier expired encounters are left out. */
    KEEP_LAST("keep-last");

    private final String value;

    RepeatDecedentPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static RepeatDecedentPolicy fromValue(String value) {
        if (value == null) {
            return EVALUATE_ALL;
        }
        for (RepeatDecedentPolicy policy : values()) {
            if (policy.value.equalsIgnoreCase(value.trim())) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown RepeatDecedentPolicy: " + value);
    }
}
