package com.donorid.model.clinical;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * CLIF hospitalization table. The aggregation root for every derived feature and flag.
 */
@Entity
@Table(name = "hospitalization", indexes = {
    @Index(name = "idx_hospitalization_patient", columnList = "patient_id"),
    @Index(name = "idx_hospitalization_discharge_category", columnList = "discharge_category")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Hospitalization {

    public static final String EXPIRED = "expired";

    @Id
    @Column(name = "hospitalization_id", length = 100)
    private String hospitalizationId;

    @Column(name = "patient_id", nullable = false, length = 100)
    private String patientId;

    @Column(name = "admission_dttm")
    private LocalDateTime admissionDttm;

    @Column(name = "discharge_dttm")
    private LocalDateTime dischargeDttm;

    @Column(name = "discharge_category", length = 100)
    private String dischargeCategory;

    @Column(name = "admission_type_category", length = 100)
    private String admissionTypeCategory;

    @Column(name = "age_at_admission")
    private Integer ageAtAdmission;

    public boolean isExpired() {
        return dischargeCategory != null && EXPIRED.equalsIgnoreCase(dischargeCategory.trim());
    }
}
