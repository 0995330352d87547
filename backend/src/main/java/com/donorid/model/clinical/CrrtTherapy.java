package com.donorid.model.clinical;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * CLIF CRRT therapy table. Any row disqualifies kidney eligibility.
 */
@Entity
@Table(name = "crrt_therapy", indexes = {
    @Index(name = "idx_crrt_therapy_hospitalization", columnList = "hospitalization_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CrrtTherapy implements ClinicalEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hospitalization_id", nullable = false, length = 100)
    private String hospitalizationId;

    @Column(name = "recorded_dttm")
    private LocalDateTime recordedDttm;

    @Column(name = "crrt_mode_category", length = 100)
    private String crrtModeCategory;

    @Override
    public LocalDateTime getEventTime() {
        return recordedDttm;
    }
}
