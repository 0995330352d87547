package com.donorid.service;

import com.donorid.model.eligibility.AnnotatedHospitalization;
import com.donorid.model.eligibility.CohortAssignment;
import com.donorid.model.eligibility.CriterionFlags;
import com.donorid.model.eligibility.StageTrace;
import com.donorid.model.eligibility.StageTraceEntry;
import com.donorid.model.enums.CohortDefinition;
import com.donorid.model.enums.EligibilityStage;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks the stages of a cohort definition in order.
 * A hospitalization leaves the cohort at its first failing stage; later stage results are still recorded.
 */
@Service
public class CohortComposerService {

    public CohortAssignment assign(CriterionFlags flags, CohortDefinition definition) {
        Map<EligibilityStage, Boolean> results = new LinkedHashMap<>();
        EligibilityStage exclusion = null;
        for (EligibilityStage stage : definition.getStages()) {
            boolean passed = flags.passes(stage, definition);
            results.put(stage, passed);
            if (!passed && exclusion == null) {
                exclusion = stage;
            }
        }
        return new CohortAssignment(definition, results, exclusion);
    }

    /**
     * Cohort size across every stage of the definition, starting from all hospitalizations.
     */
    public StageTrace trace(CohortDefinition definition, List<AnnotatedHospitalization> hospitalizations) {
        StageTrace trace = new StageTrace(definition);
        long remaining = hospitalizations.size();
        for (EligibilityStage stage : definition.getStages()) {
            long excluded = hospitalizations.stream()
                .map(h -> h.assignments().get(definition))
                .filter(a -> a != null && a.exclusionStage() == stage)
                .count();
            trace.append(new StageTraceEntry(stage, remaining, remaining - excluded, excluded, stage.getDropReason()));
            remaining -= excluded;
        }
        return trace;
    }
}
