package com.donorid.service;

import com.donorid.model.eligibility.FunnelRow;
import com.donorid.model.eligibility.StageTrace;
import com.donorid.model.eligibility.StageTraceEntry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a stage trace into the ordered rows of a flow diagram.
 */
@Service
public class FunnelTrackerService {

    /**
     * @param includedCount hospitalizations whose terminal state is included
     * @throws IllegalStateException if the remaining counts increase or do not end at {@code includedCount}
     */
    public List<FunnelRow> toFunnel(StageTrace trace, long includedCount) {
        List<FunnelRow> rows = new ArrayList<>();
        long previous = trace.getInitialSize();
        int order = 1;
        for (StageTraceEntry entry : trace.getEntries()) {
            if (entry.cohortSizeAfter() > previous) {
                throw new IllegalStateException(trace.getDefinition().getValue() + " funnel grows at stage "
                    + entry.stage().getValue() + ": " + previous + " -> " + entry.cohortSizeAfter());
            }
            rows.add(new FunnelRow(order++, entry.stage(), entry.cohortSizeAfter(), entry.excludedCount(),
                entry.exclusionReason()));
            previous = entry.cohortSizeAfter();
        }
        if (trace.getFinalSize() != includedCount) {
            throw new IllegalStateException(trace.getDefinition().getValue() + " funnel ends at "
                + trace.getFinalSize() + " but " + includedCount + " hospitalizations are included");
        }
        return List.copyOf(rows);
    }
}
