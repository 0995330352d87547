package com.donorid.model.clinical;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * CLIF microbiology culture table.
 */
@Entity
@Table(name = "microbiology_culture", indexes = {
    @Index(name = "idx_microbiology_culture_hospitalization", columnList = "hospitalization_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MicrobiologyCulture implements ClinicalEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "hospitalization_id", nullable = false, length = 100)
    private String hospitalizationId;

    @Column(name = "collect_dttm")
    private LocalDateTime collectDttm;

    @Column(name = "fluid_category", length = 100)
    private String fluidCategory;

    @Column(name = "method_category", length = 100)
    private String methodCategory;

    @Column(name = "organism_category", length = 255)
    private String organismCategory;

    @Override
    public LocalDateTime getEventTime() {
        return collectDttm;
    }
}
