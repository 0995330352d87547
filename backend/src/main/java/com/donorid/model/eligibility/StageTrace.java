package com.donorid.model.eligibility;

import com.donorid.model.enums.CohortDefinition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only sequence of stage transitions for one definition.
 */
public class StageTrace {

    private final CohortDefinition definition;
    private final List<StageTraceEntry> entries = new ArrayList<>();

    public StageTrace(CohortDefinition definition) {
        this.definition = definition;
    }

    public CohortDefinition getDefinition() {
        return definition;
    }

    public void append(StageTraceEntry entry) {
        if (!entries.isEmpty()) {
            long previous = entries.get(entries.size() - 1).cohortSizeAfter();
            if (entry.cohortSizeBefore() != previous) {
                throw new IllegalArgumentException("Stage " + entry.stage() + " starts at "
                    + entry.cohortSizeBefore() + " but previous stage ended at " + previous);
            }
        }
        entries.add(entry);
    }

    public List<StageTraceEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    /**
     * Cohort size before the first stage.
     */
    public long getInitialSize() {
        return entries.isEmpty() ? 0 : entries.get(0).cohortSizeBefore();
    }

    /**
     * Cohort size after the last stage.
     */
    public long getFinalSize() {
        return entries.isEmpty() ? 0 : entries.get(entries.size() - 1).cohortSizeAfter();
    }
}
