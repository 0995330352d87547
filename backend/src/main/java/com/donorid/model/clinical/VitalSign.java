package com.donorid.model.clinical;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * CLIF vitals table.
 */
@Entity
@Table(name = "vitals", indexes = {
    @Index(name = "idx_vitals_hospitalization", columnList = "hospitalization_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VitalSign implements ClinicalEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hospitalization_id", nullable = false, length = 100)
    private String hospitalizationId;

    @Column(name = "recorded_dttm")
    private LocalDateTime recordedDttm;

    @Column(name = "vital_category", length = 100)
    private String vitalCategory;

    @Column(name = "vital_value")
    private Double vitalValue;

    @Override
    public LocalDateTime getEventTime() {
        return recordedDttm;
    }
}
