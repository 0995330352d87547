package com.donorid.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What a criterion returns when a required input is unknown.
 * Every evaluator routes missing inputs through this single policy.
 */
public enum MissingDataPolicy {
    FAIL("fail", false),
    PASS("pass", true);

    private final String value;
    private final boolean outcome;

    MissingDataPolicy(String value, boolean outcome) {
        this.value = value;
        this.outcome = outcome;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Criterion result to use when an input is unknown.
     */
    public boolean outcomeWhenUnknown() {
        return outcome;
    }

    public static MissingDataPolicy fromValue(String value) {
        if (value == null) {
            return FAIL;
        }
        for (MissingDataPolicy policy : values()) {
            if (policy.value.equalsIgnoreCase(value.trim())) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown MissingDataPolicy: " + value);
    }
}
