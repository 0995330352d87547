package com.donorid.model.summary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One line of the descriptive summary table. Values are keyed by group label.
 */
public record SummaryRow(String variable, String category, Map<String, String> values) {

    public SummaryRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
