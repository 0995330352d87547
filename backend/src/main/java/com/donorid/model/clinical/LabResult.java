package com.donorid.model.clinical;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * CLIF labs table.
 */
@Entity
@Table(name = "labs", indexes = {
    @Index(name = "idx_labs_hospitalization", columnList = "hospitalization_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LabResult implements ClinicalEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hospitalization_id", nullable = false, length = 100)
    private String hospitalizationId;

    @Column(name = "lab_collect_dttm")
    private LocalDateTime labCollectDttm;

    @Column(name = "lab_category", length = 100)
    private String labCategory;

    @Column(name = "lab_value_numeric")
    private Double labValueNumeric;

    @Column(name = "reference_unit", length = 50)
    private String referenceUnit;

    @Override
    public LocalDateTime getEventTime() {
        return labCollectDttm;
    }
}
