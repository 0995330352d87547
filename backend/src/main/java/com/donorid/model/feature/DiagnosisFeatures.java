package com.donorid.model.feature;

import com.donorid.model.enums.DiagnosisCategory;

import java.util.Set;

/**
 * Diagnosis categories present during the stay.
 *
 * @param categories     matched categories
 * @param skippedRecords rows ignored because their code format is not ICD-10
 */
public record DiagnosisFeatures(Set<DiagnosisCategory> categories, int skippedRecords) {

    public DiagnosisFeatures {
        categories = Set.copyOf(categories);
    }

    public static DiagnosisFeatures none() {
        return new DiagnosisFeatures(Set.of(), 0);
    }

    public boolean has(DiagnosisCategory category) {
        return categories.contains(category);
    }

    public boolean hasQualifyingCause() {
        return categories.stream().anyMatch(DiagnosisCategory::isQualifyingCause);
    }

    public boolean hasContraindication() {
        return has(DiagnosisCategory.SEPSIS) || has(DiagnosisCategory.ACTIVE_CANCER);
    }
}
