package com.donorid.service;

import com.donorid.model.eligibility.FunnelRow;
import com.donorid.model.eligibility.StageTrace;
import com.donorid.model.eligibility.StageTraceEntry;
import com.donorid.model.enums.CohortDefinition;
import com.donorid.model.enums.EligibilityStage;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FunnelTrackerServiceTest {

    private final FunnelTrackerService tracker = new FunnelTrackerService();

    @Test
    void buildsOrderedRows() {
        StageTrace trace = new StageTrace(CohortDefinition.CALC);
        trace.append(entry(EligibilityStage.EXPIRED, 10, 4));
        trace.append(entry(EligibilityStage.DEATH_TIME_KNOWN, 4, 4));
        trace.append(entry(EligibilityStage.AGE, 4, 3));
        trace.append(entry(EligibilityStage.CAUSE, 3, 1));
        trace.append(entry(EligibilityStage.NO_CONTRAINDICATION, 1, 1));

        List<FunnelRow> rows = tracker.toFunnel(trace, 1);

        assertThat(rows).extracting(FunnelRow::stageOrder).containsExactly(1, 2, 3, 4, 5);
        assertThat(rows).extracting(FunnelRow::nRemaining).containsExactly(4L, 4L, 3L, 1L, 1L);
        assertThat(rows).extracting(FunnelRow::nDropped).containsExactly(6L, 0L, 1L, 2L, 0L);
        assertThat(rows.get(0).dropReason()).isEqualTo("not an inpatient death");
    }

    @Test
    void rejectsFinalCountThatDisagreesWithIncluded() {
        StageTrace trace = new StageTrace(CohortDefinition.CALC);
        trace.append(entry(EligibilityStage.EXPIRED, 5, 2));

        assertThatThrownBy(() -> tracker.toFunnel(trace, 3))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("ends at 2");
    }

    @Test
    void traceRejectsDiscontinuousStages() {
        StageTrace trace = new StageTrace(CohortDefinition.CLIF);
        trace.append(entry(EligibilityStage.EXPIRED, 5, 3));

        assertThatThrownBy(() -> trace.append(entry(EligibilityStage.DEATH_TIME_KNOWN, 4, 4)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void emptyTraceHasNoRows() {
        assertThat(tracker.toFunnel(new StageTrace(CohortDefinition.CLIF), 0)).isEmpty();
    }

    private static StageTraceEntry entry(EligibilityStage stage, long before, long after) {
        return new StageTraceEntry(stage, before, after, before - after, stage.getDropReason());
    }
}
