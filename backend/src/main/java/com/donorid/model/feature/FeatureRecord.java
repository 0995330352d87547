package com.donorid.model.feature;

import lombok.Builder;

import java.time.LocalDateTime;
import java.util.List;

/**
 * One row per hospitalization: every event table folded to scalars.
 * The death time is unknown for hospitalizations that are not expired or lack a usable timestamp.
 *
 * @param sourceHospitalizationIds the source stays behind this row, more than one when stays were stitched
 */
@Builder(toBuilder = true)
public record FeatureRecord(
    String hospitalizationId,
    List<String> sourceHospitalizationIds,
    String patientId,
    boolean expired,
    FeatureValue<LocalDateTime> deathTime,
    LocalDateTime admissionTime,
    FeatureValue<Double> ageYears,
    String raceCategory,
    String ethnicityCategory,
    String sexCategory,
    LabFeatures labs,
    VitalFeatures vitals,
    boolean imvWithinLookback,
    boolean positiveBloodCulture,
    boolean crrtDuringStay,
    DiagnosisFeatures diagnoses,
    AssessmentFeatures assessments,
    LocationFeatures location
) {}
