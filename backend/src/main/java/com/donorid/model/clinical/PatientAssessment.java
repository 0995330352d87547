package com.donorid.model.clinical;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * CLIF patient assessments table (GCS, RASS).
 */
@Entity
@Table(name = "patient_assessments", indexes = {
    @Index(name = "idx_patient_assessments_hospitalization", columnList = "hospitalization_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientAssessment implements ClinicalEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hospitalization_id", nullable = false, length = 100)
    private String hospitalizationId;

    @Column(name = "recorded_dttm")
    private LocalDateTime recordedDttm;

    @Column(name = "assessment_category", length = 100)
    private String assessmentCategory;

    @Column(name = "numerical_value")
    private Double numericalValue;

    @Override
    public LocalDateTime getEventTime() {
        return recordedDttm;
    }
}
