package com.donorid.model.clinical;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * CLIF respiratory support table. Only the device category is used for eligibility.
 */
@Entity
@Table(name = "respiratory_support", indexes = {
    @Index(name = "idx_respiratory_support_hospitalization", columnList = "hospitalization_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RespiratorySupport implements ClinicalEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hospitalization_id", nullable = false, length = 100)
    private String hospitalizationId;

    @Column(name = "recorded_dttm")
    private LocalDateTime recordedDttm;

    @Column(name = "device_category", length = 100)
    private String deviceCategory;

    @Column(name = "mode_category", length = 100)
    private String modeCategory;

    @Override
    public LocalDateTime getEventTime() {
        return recordedDttm;
    }
}
