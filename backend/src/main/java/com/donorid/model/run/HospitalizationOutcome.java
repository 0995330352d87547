package com.donorid.model.run;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the annotated output table: terminal state under both definitions, every criterion flag and the
 * key features behind them.
 */
@Entity
@Table(name = "hospitalization_outcome", indexes = {
    @Index(name = "idx_outcome_run", columnList = "run_id"),
    @Index(name = "idx_outcome_hospitalization", columnList = "hospitalization_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HospitalizationOutcome {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "run_id", nullable = false)
    private CohortRun run;

    @Column(name = "hospitalization_id", nullable = false, length = 100)
    private String hospitalizationId;

    /**
     * Comma-separated source hospitalization ids when stays were stitched, else the id itself.
     */
    @Column(name = "source_hospitalization_ids", length = 1000)
    private String sourceHospitalizationIds;

    @Column(name = "patient_id", length = 100)
    private String patientId;

    /**
     * "included" or "excluded@{stage}".
     */
    @Column(name = "calc_state", nullable = false, length = 50)
    private String calcState;

    @Column(name = "clif_state", nullable = false, length = 50)
    private String clifState;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "hospitalization_outcome_flag", joinColumns = @JoinColumn(name = "outcome_id"))
    @MapKeyColumn(name = "flag", length = 50)
    @Column(name = "passed")
    @Builder.Default
    private Map<String, Boolean> flags = new LinkedHashMap<>();

    // Key features; null when unknown

    @Column(name = "death_dttm")
    private LocalDateTime deathDttm;

    @Column(name = "age_years")
    private Double ageYears;

    @Column(name = "location_at_death", length = 50)
    private String locationAtDeath;

    @Column(name = "ever_icu", nullable = false)
    private boolean everIcu;

    @Column(name = "max_creatinine")
    private Double maxCreatinine;

    @Column(name = "max_bilirubin_total")
    private Double maxBilirubinTotal;

    @Column(name = "max_ast")
    private Double maxAst;

    @Column(name = "max_alt")
    private Double maxAlt;

    @Column(name = "bmi")
    private Double bmi;

    @Column(name = "imv_within_lookback", nullable = false)
    private boolean imvWithinLookback;

    @Column(name = "positive_blood_culture", nullable = false)
    private boolean positiveBloodCulture;

    @Column(name = "crrt_during_stay", nullable = false)
    private boolean crrtDuringStay;

    @Column(name = "first_vital_dttm")
    private LocalDateTime firstVitalDttm;

    @Column(name = "last_vital_dttm")
    private LocalDateTime lastVitalDttm;
}
