package com.donorid.model.eligibility;

import com.donorid.model.enums.DataQualityIssue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts of non-fatal data problems seen during one run.
 */
public class DataQualityReport {

    private final Map<DataQualityIssue, Long> counts = new EnumMap<>(DataQualityIssue.class);

    public void record(DataQualityIssue issue) {
        record(issue, 1);
    }

    public void record(DataQualityIssue issue, long occurrences) {
        if (occurrences > 0) {
            counts.merge(issue, occurrences, Long::sum);
        }
    }

    public long count(DataQualityIssue issue) {
        return counts.getOrDefault(issue, 0L);
    }

    public Map<DataQualityIssue, Long> asMap() {
        Map<DataQualityIssue, Long> snapshot = new EnumMap<>(DataQualityIssue.class);
        for (DataQualityIssue issue : DataQualityIssue.values()) {
            snapshot.put(issue, count(issue));
        }
        return Collections.unmodifiableMap(snapshot);
    }
}
