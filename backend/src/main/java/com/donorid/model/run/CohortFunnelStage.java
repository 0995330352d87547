package com.donorid.model.run;

import com.donorid.model.enums.CohortDefinition;
import com.donorid.model.enums.EligibilityStage;
import jakarta.persistence.*;
import lombok.*;

/**
 * One funnel row of a persisted run.
 */
@Entity
@Table(name = "cohort_funnel_stage", indexes = {
    @Index(name = "idx_funnel_stage_run", columnList = "run_id, definition, stage_order")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CohortFunnelStage {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "run_id", nullable = false)
    private CohortRun run;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CohortDefinition definition;

    @Column(name = "stage_order", nullable = false)
    private int stageOrder;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 50)
    private EligibilityStage stage;

    @Column(name = "n_remaining", nullable = false)
    private long nRemaining;

    @Column(name = "n_dropped", nullable = false)
    private long nDropped;

    @Column(name = "drop_reason", length = 255)
    private String dropReason;
}
