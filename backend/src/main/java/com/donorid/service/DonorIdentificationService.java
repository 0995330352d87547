package com.donorid.service;

import com.donorid.dataset.ClinicalDataset;
import com.donorid.model.clinical.Hospitalization;
import com.donorid.model.clinical.Patient;
import com.donorid.model.eligibility.*;
import com.donorid.model.enums.CohortDefinition;
import com.donorid.model.enums.DataQualityIssue;
import com.donorid.model.feature.FeatureRecord;
import com.donorid.service.icd.DiagnosisClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Runs the cohort engine over a loaded dataset: features, criterion flags, per-definition assignment,
 * stage traces, funnels and the descriptive summary.
 * <p>
 * Hospitalizations are independent of one another; one hospitalization's bad data never aborts the run.
 */
@Service
@Slf4j
public class DonorIdentificationService {

    private final FeatureExtractionService featureExtractionService;
    private final CriterionEvaluatorService criterionEvaluatorService;
    private final CohortComposerService cohortComposerService;
    private final FunnelTrackerService funnelTrackerService;
    private final CohortSummaryService cohortSummaryService;
    private final DiagnosisClassifier diagnosisClassifier;

    @Value("${donor.site-name:unknown}")
    private String siteName;

    public DonorIdentificationService(
            FeatureExtractionService featureExtractionService,
            CriterionEvaluatorService criterionEvaluatorService,
            CohortComposerService cohortComposerService,
            FunnelTrackerService funnelTrackerService,
            CohortSummaryService cohortSummaryService,
            DiagnosisClassifier diagnosisClassifier) {
        this.featureExtractionService = featureExtractionService;
        this.criterionEvaluatorService = criterionEvaluatorService;
        this.cohortComposerService = cohortComposerService;
        this.funnelTrackerService = funnelTrackerService;
        this.cohortSummaryService = cohortSummaryService;
        this.diagnosisClassifier = diagnosisClassifier;
    }

    public CohortRunResult run(ClinicalDataset dataset) {
        return run(dataset, siteName);
    }

    /**
     * @param site site label stored with the result; metadata only
     */
    public CohortRunResult run(ClinicalDataset dataset, String site) {
        DataQualityReport report = new DataQualityReport();
        report.record(DataQualityIssue.MISSING_REQUIRED_FIELD, dataset.getRowsWithoutKey());
        if (dataset.getRowsWithoutKey() > 0) {
            log.warn("{} source rows skipped for missing key columns", dataset.getRowsWithoutKey());
        }
        if (dataset.getRepeatDecedentsLeftOut() > 0) {
            log.info("{} earlier expired encounters of repeat decedents left out", dataset.getRepeatDecedentsLeftOut());
        }
        warnRepeatDecedents(dataset.getHospitalizations());

        List<AnnotatedHospitalization> annotated = new ArrayList<>();
        int missingFromAdt = 0;
        for (Hospitalization hospitalization : dataset.getHospitalizations()) {
            Patient patient = dataset.findPatient(hospitalization.getPatientId()).orElse(null);
            FeatureRecord features = featureExtractionService.extract(hospitalization, patient, dataset, report);
            if (features.expired() && !dataset.getAdt().containsHospitalization(hospitalization.getHospitalizationId())) {
                missingFromAdt++;
            }
            CriterionFlags flags = criterionEvaluatorService.evaluate(features);
            Map<CohortDefinition, CohortAssignment> assignments = new EnumMap<>(CohortDefinition.class);
            for (CohortDefinition definition : CohortDefinition.values()) {
                assignments.put(definition, cohortComposerService.assign(flags, definition));
            }
            annotated.add(new AnnotatedHospitalization(features, flags, assignments));
        }
        if (missingFromAdt > 0) {
            log.warn("{} expired hospitalizations have no ADT rows", missingFromAdt);
        }

        Map<CohortDefinition, StageTrace> traces = new EnumMap<>(CohortDefinition.class);
        Map<CohortDefinition, List<FunnelRow>> funnels = new EnumMap<>(CohortDefinition.class);
        for (CohortDefinition definition : CohortDefinition.values()) {
            StageTrace trace = cohortComposerService.trace(definition, annotated);
            long included = annotated.stream().filter(h -> h.isIncluded(definition)).count();
            traces.put(definition, trace);
            funnels.put(definition, funnelTrackerService.toFunnel(trace, included));
            logTrace(trace);
        }

        Map<DataQualityIssue, Long> dataQuality = report.asMap();
        log.info("Data quality for site {}: {}", site, dataQuality);

        return new CohortRunResult(
            site,
            diagnosisClassifier.getVersion(),
            List.copyOf(annotated),
            Collections.unmodifiableMap(traces),
            Collections.unmodifiableMap(funnels),
            dataQuality,
            cohortSummaryService.summarize(annotated)
        );
    }

    /**
     * Patients with more than one expired hospitalization left after stitching and the repeat-decedent policy.
     */
    static Map<String, Long> repeatDecedents(List<Hospitalization> hospitalizations) {
        return hospitalizations.stream()
            .filter(Hospitalization::isExpired)
            .collect(Collectors.groupingBy(Hospitalization::getPatientId, TreeMap::new, Collectors.counting()))
            .entrySet().stream()
            .filter(e -> e.getValue() > 1)
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, TreeMap::new));
    }

    private void warnRepeatDecedents(List<Hospitalization> hospitalizations) {
        Map<String, Long> repeats = repeatDecedents(hospitalizations);
        if (!repeats.isEmpty()) {
            log.warn("{} patients have more than one expired hospitalization: {}", repeats.size(), repeats.keySet());
        }
    }

    private void logTrace(StageTrace trace) {
        log.info("{} cohort: {} hospitalizations evaluated", trace.getDefinition().getValue(), trace.getInitialSize());
        for (StageTraceEntry entry : trace.getEntries()) {
            log.info("  {} -> {} remaining, {} excluded ({})", entry.stage().getValue(), entry.cohortSizeAfter(),
                entry.excludedCount(), entry.exclusionReason());
        }
    }
}
