package com.donorid.dto.mapper;

import com.donorid.dto.response.*;
import com.donorid.model.enums.CohortDefinition;
import com.donorid.model.run.CohortFunnelStage;
import com.donorid.model.run.CohortRun;
import com.donorid.model.run.HospitalizationOutcome;
import com.donorid.service.CohortRunService;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Mapper for converting persisted cohort runs to DTOs.
 */
@Component
public class CohortRunMapper {

    private final CohortRunService cohortRunService;

    public CohortRunMapper(CohortRunService cohortRunService) {
        this.cohortRunService = cohortRunService;
    }

    public CohortRunSummaryDto toSummaryDto(CohortRun run) {
        return new CohortRunSummaryDto(
            run.getId(),
            run.getSiteName(),
            run.getReferenceVersion(),
            run.getExecutedAt(),
            run.getHospitalizationCount(),
            run.getCalcIncluded(),
            run.getClifIncluded()
        );
    }

    public List<CohortRunSummaryDto> toSummaryDtoList(List<CohortRun> runs) {
        return runs.stream().map(this::toSummaryDto).toList();
    }

    public CohortRunDto toDto(CohortRun run) {
        Map<String, List<FunnelRowDto>> funnels = new LinkedHashMap<>();
        for (CohortDefinition definition : CohortDefinition.values()) {
            funnels.put(definition.getValue(), toFunnelDtoList(run.getFunnelStages().stream()
                .filter(stage -> stage.getDefinition() == definition)
                .toList()));
        }
        return new CohortRunDto(
            run.getId(),
            run.getSiteName(),
            run.getReferenceVersion(),
            run.getExecutedAt(),
            run.getHospitalizationCount(),
            run.getCalcIncluded(),
            run.getClifIncluded(),
            funnels,
            new LinkedHashMap<>(run.getDataQuality()),
            cohortRunService.readSummary(run)
        );
    }

    public FunnelRowDto toFunnelDto(CohortFunnelStage stage) {
        return new FunnelRowDto(
            stage.getStageOrder(),
            stage.getStage().getValue(),
            stage.getNRemaining(),
            stage.getNDropped(),
            stage.getDropReason()
        );
    }

    public List<FunnelRowDto> toFunnelDtoList(List<CohortFunnelStage> stages) {
        return stages.stream().map(this::toFunnelDto).toList();
    }

    public HospitalizationOutcomeDto toOutcomeDto(HospitalizationOutcome outcome) {
        List<String> sourceIds = outcome.getSourceHospitalizationIds() == null
            ? List.of(outcome.getHospitalizationId())
            : List.of(outcome.getSourceHospitalizationIds().split(","));
        return new HospitalizationOutcomeDto(
            outcome.getHospitalizationId(),
            sourceIds,
            outcome.getPatientId(),
            outcome.getCalcState(),
            outcome.getClifState(),
            new TreeMap<>(outcome.getFlags()),
            outcome.getDeathDttm(),
            outcome.getAgeYears(),
            outcome.getLocationAtDeath(),
            outcome.isEverIcu(),
            outcome.getMaxCreatinine(),
            outcome.getMaxBilirubinTotal(),
            outcome.getMaxAst(),
            outcome.getMaxAlt(),
            outcome.getBmi(),
            outcome.isImvWithinLookback(),
            outcome.isPositiveBloodCulture(),
            outcome.isCrrtDuringStay(),
            outcome.getFirstVitalDttm(),
            outcome.getLastVitalDttm()
        );
    }
}
