package com.donorid.model.clinical;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDate;
import java.time.LocalDateTime;

/**
 * CLIF patient table: demographics and the recorded death time.
 */
@Entity
@Table(name = "patient")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Patient {

    @Id
    @Column(name = "patient_id", length = 100)
    private String patientId;

    @Column(name = "birth_date")
    private LocalDate birthDate;

    @Column(name = "death_dttm")
    private LocalDateTime deathDttm;

    @Column(name = "race_category", length = 100)
    private String raceCategory;

    @Column(name = "ethnicity_category", length = 100)
    private String ethnicityCategory;

    @Column(name = "sex_category", length = 50)
    private String sexCategory;
}
