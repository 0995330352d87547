package com.donorid.model.clinical;

import jakarta.persistence.*;
import lombok.*;

/**
 * CLIF hospital diagnosis table. Rows carry no timestamp and apply to the whole stay.
 */
@Entity
@Table(name = "hospital_diagnosis", indexes = {
    @Index(name = "idx_hospital_diagnosis_hospitalization", columnList = "hospitalization_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HospitalDiagnosis {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hospitalization_id", nullable = false, length = 100)
    private String hospitalizationId;

    @Column(name = "diagnosis_code", length = 50)
    private String diagnosisCode;

    @Column(name = "diagnosis_code_format", length = 50)
    private String diagnosisCodeFormat;

    @Column(name = "diagnosis_primary")
    private Integer diagnosisPrimary;
}
