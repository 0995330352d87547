package com.donorid.model.clinical;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * CLIF ADT table: one row per location stay.
 */
@Entity
@Table(name = "adt", indexes = {
    @Index(name = "idx_adt_hospitalization", columnList = "hospitalization_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdtRecord implements ClinicalEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hospitalization_id", nullable = false, length = 100)
    private String hospitalizationId;

    @Column(name = "in_dttm")
    private LocalDateTime inDttm;

    @Column(name = "out_dttm")
    private LocalDateTime outDttm;

    @Column(name = "location_category", length = 100)
    private String locationCategory;

    @Column(name = "location_name", length = 255)
    private String locationName;

    @Override
    public LocalDateTime getEventTime() {
        return inDttm;
    }
}
