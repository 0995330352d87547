package com.donorid.service;

import com.donorid.dataset.ClinicalDataset;
import com.donorid.model.eligibility.AnnotatedHospitalization;
import com.donorid.model.eligibility.CohortRunResult;
import com.donorid.model.eligibility.FunnelRow;
import com.donorid.model.enums.CohortDefinition;
import com.donorid.model.enums.LocationCategory;
import com.donorid.model.feature.FeatureRecord;
import com.donorid.model.run.CohortFunnelStage;
import com.donorid.model.run.CohortRun;
import com.donorid.model.run.HospitalizationOutcome;
import com.donorid.model.summary.SummaryRow;
import com.donorid.repository.CohortRunRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;

/**
 * Executes the engine against the stored source tables and persists the outcome.
 */
@Service
@Transactional
@Slf4j
public class CohortRunService {

    private final ClinicalDatasetLoader datasetLoader;
    private final DonorIdentificationService donorIdentificationService;
    private final CohortRunRepository cohortRunRepository;
    private final ObjectMapper objectMapper;

    public CohortRunService(
            ClinicalDatasetLoader datasetLoader,
            DonorIdentificationService donorIdentificationService,
            CohortRunRepository cohortRunRepository,
            ObjectMapper objectMapper) {
        this.datasetLoader = datasetLoader;
        this.donorIdentificationService = donorIdentificationService;
        this.cohortRunRepository = cohortRunRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Load, evaluate and persist.
     *
     * @param siteName label for the run; the configured site name when null or blank
     */
    public CohortRun execute(String siteName) {
        ClinicalDataset dataset = datasetLoader.load();
        CohortRunResult result = siteName == null || siteName.isBlank()
            ? donorIdentificationService.run(dataset)
            : donorIdentificationService.run(dataset, siteName.trim());
        CohortRun saved = cohortRunRepository.save(toEntity(result));
        log.info("Persisted cohort run {} for site {}: CALC={}, CLIF={}", saved.getId(), saved.getSiteName(),
            saved.getCalcIncluded(), saved.getClifIncluded());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<CohortRun> findAll() {
        return cohortRunRepository.findAllByOrderByExecutedAtDesc();
    }

    @Transactional(readOnly = true)
    public List<CohortRun> findBySite(String siteName) {
        return cohortRunRepository.findBySiteNameOrderByExecutedAtDesc(siteName);
    }

    @Transactional(readOnly = true)
    public Optional<CohortRun> findById(Long id) {
        return cohortRunRepository.findById(id);
    }

    /**
     * Funnel rows of one definition, in stage order.
     */
    @Transactional(readOnly = true)
    public Optional<List<CohortFunnelStage>> findFunnel(Long id, CohortDefinition definition) {
        return cohortRunRepository.findById(id)
            .map(run -> run.getFunnelStages().stream()
                .filter(stage -> stage.getDefinition() == definition)
                .toList());
    }

    public List<SummaryRow> readSummary(CohortRun run) {
        if (run.getSummaryJson() == null) {
            return List.of();
        }
        try {
            return objectMapper.readValue(run.getSummaryJson(), new TypeReference<List<SummaryRow>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored summary of run " + run.getId() + " is not readable", e);
        }
    }

    // ========================================================================
    // Mapping
    // ========================================================================

    private CohortRun toEntity(CohortRunResult result) {
        CohortRun run = CohortRun.builder()
            .siteName(result.siteName())
            .referenceVersion(result.referenceVersion())
            .executedAt(LocalDateTime.now())
            .hospitalizationCount(result.hospitalizations().size())
            .calcIncluded(result.includedCount(CohortDefinition.CALC))
            .clifIncluded(result.includedCount(CohortDefinition.CLIF))
            .summaryJson(writeSummary(result.summary()))
            .build();
        result.dataQuality().forEach((issue, count) -> run.getDataQuality().put(issue.getValue(), count));

        result.funnels().forEach((definition, rows) -> {
            for (FunnelRow row : rows) {
                run.addFunnelStage(CohortFunnelStage.builder()
                    .definition(definition)
                    .stageOrder(row.stageOrder())
                    .stage(row.stage())
                    .nRemaining(row.nRemaining())
                    .nDropped(row.nDropped())
                    .dropReason(row.dropReason())
                    .build());
            }
        });

        for (AnnotatedHospitalization hospitalization : result.hospitalizations()) {
            run.addOutcome(toOutcome(hospitalization));
        }
        return run;
    }

    private static HospitalizationOutcome toOutcome(AnnotatedHospitalization hospitalization) {
        FeatureRecord features = hospitalization.features();
        List<String> sourceIds = features.sourceHospitalizationIds() != null
            ? features.sourceHospitalizationIds()
            : List.of(features.hospitalizationId());
        return HospitalizationOutcome.builder()
            .hospitalizationId(features.hospitalizationId())
            .sourceHospitalizationIds(String.join(",", sourceIds))
            .patientId(features.patientId())
            .calcState(hospitalization.assignments().get(CohortDefinition.CALC).terminalState())
            .clifState(hospitalization.assignments().get(CohortDefinition.CLIF).terminalState())
            .flags(new LinkedHashMap<>(hospitalization.flags().asMap()))
            .deathDttm(features.deathTime().orElse(null))
            .ageYears(features.ageYears().orElse(null))
            .locationAtDeath(features.location().locationAtDeath().map(LocationCategory::getValue).orElse(null))
            .everIcu(features.location().everIn(LocationCategory.ICU))
            .maxCreatinine(features.labs().creatinine().orElse(null))
            .maxBilirubinTotal(features.labs().bilirubinTotal().orElse(null))
            .maxAst(features.labs().ast().orElse(null))
            .maxAlt(features.labs().alt().orElse(null))
            .bmi(features.vitals().bmi().orElse(null))
            .imvWithinLookback(features.imvWithinLookback())
            .positiveBloodCulture(features.positiveBloodCulture())
            .crrtDuringStay(features.crrtDuringStay())
            .firstVitalDttm(features.vitals().firstRecorded().orElse(null))
            .lastVitalDttm(features.vitals().lastRecorded().orElse(null))
            .build();
    }

    private String writeSummary(List<SummaryRow> summary) {
        try {
            return objectMapper.writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize summary table", e);
        }
    }
}
