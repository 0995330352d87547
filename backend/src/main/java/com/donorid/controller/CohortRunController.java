package com.donorid.controller;

import com.donorid.dto.mapper.CohortRunMapper;
import com.donorid.dto.request.CohortRunRequest;
import com.donorid.dto.response.CohortRunDto;
import com.donorid.dto.response.CohortRunSummaryDto;
import com.donorid.dto.response.FunnelRowDto;
import com.donorid.dto.response.HospitalizationOutcomeDto;
import com.donorid.model.enums.CohortDefinition;
import com.donorid.model.run.CohortRun;
import com.donorid.service.CohortRunService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for cohort runs: execute the engine and read back persisted results.
 */
@RestController
@RequestMapping("/api/cohort-runs")
public class CohortRunController {

    private final CohortRunService cohortRunService;
    private final CohortRunMapper cohortRunMapper;

    public CohortRunController(CohortRunService cohortRunService, CohortRunMapper cohortRunMapper) {
        this.cohortRunService = cohortRunService;
        this.cohortRunMapper = cohortRunMapper;
    }

    /**
     * Run both cohort definitions over the stored source tables.
     */
    @PostMapping
    public ResponseEntity<CohortRunDto> createRun(@Valid @RequestBody(required = false) CohortRunRequest request) {
        CohortRun run = cohortRunService.execute(request != null ? request.siteName() : null);
        return ResponseEntity.status(HttpStatus.CREATED).body(cohortRunMapper.toDto(run));
    }

    @GetMapping
    public ResponseEntity<List<CohortRunSummaryDto>> getRuns(@RequestParam(required = false) String site) {
        List<CohortRun> runs = site != null && !site.isBlank()
            ? cohortRunService.findBySite(site)
            : cohortRunService.findAll();
        return ResponseEntity.ok(cohortRunMapper.toSummaryDtoList(runs));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CohortRunDto> getRun(@PathVariable Long id) {
        return cohortRunService.findById(id)
            .map(cohortRunMapper::toDto)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Funnel rows of one definition ("calc" or "clif").
     */
    @GetMapping("/{id}/funnel/{definition}")
    public ResponseEntity<List<FunnelRowDto>> getFunnel(@PathVariable Long id, @PathVariable String definition) {
        CohortDefinition cohortDefinition = CohortDefinition.fromValue(definition);
        return cohortRunService.findFunnel(id, cohortDefinition)
            .map(cohortRunMapper::toFunnelDtoList)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/hospitalizations")
    public ResponseEntity<List<HospitalizationOutcomeDto>> getOutcomes(@PathVariable Long id) {
        return cohortRunService.findById(id)
            .map(run -> run.getOutcomes().stream().map(cohortRunMapper::toOutcomeDto).toList())
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
}
