package com.donorid.model.run;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One persisted execution of the cohort engine over a site's dataset.
 */
@Entity
@Table(name = "cohort_run", indexes = {
    @Index(name = "idx_cohort_run_site", columnList = "site_name")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CohortRun {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "site_name", nullable = false, length = 255)
    private String siteName;

    /**
     * Version of the ICD-10 code range table used for the run.
     */
    @Column(name = "reference_version", length = 50)
    private String referenceVersion;

    @Column(name = "executed_at", nullable = false)
    private LocalDateTime executedAt;

    @Column(name = "hospitalization_count", nullable = false)
    private long hospitalizationCount;

    @Column(name = "calc_included", nullable = false)
    private long calcIncluded;

    @Column(name = "clif_included", nullable = false)
    private long clifIncluded;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "cohort_run_data_quality", joinColumns = @JoinColumn(name = "run_id"))
    @MapKeyColumn(name = "issue", length = 50)
    @Column(name = "occurrences")
    @Builder.Default
    private Map<String, Long> dataQuality = new LinkedHashMap<>();

    // Summary table rows serialized as JSON
    @Column(name = "summary_json", columnDefinition = "TEXT")
    private String summaryJson;

    @OneToMany(mappedBy = "run", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("definition ASC, stageOrder ASC")
    @Builder.Default
    private List<CohortFunnelStage> funnelStages = new ArrayList<>();

    @OneToMany(mappedBy = "run", cascade = CascadeType.ALL, orphanRemoval = true, fetch = FetchType.LAZY)
    @OrderBy("hospitalizationId ASC")
    @Builder.Default
    private List<HospitalizationOutcome> outcomes = new ArrayList<>();

    /**
     * Helper method to add a funnel stage.
     */
    public void addFunnelStage(CohortFunnelStage stage) {
        funnelStages.add(stage);
        stage.setRun(this);
    }

    /**
     * Helper method to add a hospitalization outcome.
     */
    public void addOutcome(HospitalizationOutcome outcome) {
        outcomes.add(outcome);
        outcome.setRun(this);
    }
}
