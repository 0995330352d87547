package com.donorid.service.aggregation;

import com.donorid.model.clinical.HospitalDiagnosis;
import com.donorid.model.eligibility.DataQualityReport;
import com.donorid.model.enums.DataQualityIssue;
import com.donorid.model.enums.DiagnosisCategory;
import com.donorid.model.enums.DiagnosisCodeFormat;
import com.donorid.model.feature.DiagnosisFeatures;
import com.donorid.model.window.TimeWindow;
import com.donorid.service.icd.DiagnosisClassifier;
import lombok.extern.slf4j.Slf4j;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Union of the diagnosis categories coded for the stay.
 * Diagnosis rows have no timestamp and all belong to the lifetime window.
 * Rows in a code format other than ICD-10 are skipped and counted.
 */
@Slf4j
public class DiagnosisAggregator implements EventAggregator<HospitalDiagnosis, DiagnosisFeatures> {

    private final DiagnosisClassifier classifier;

    public DiagnosisAggregator(DiagnosisClassifier classifier) {
        this.classifier = classifier;
    }

    @Override
    public DiagnosisFeatures reduce(List<HospitalDiagnosis> events, TimeWindow window, DataQualityReport report) {
        Set<DiagnosisCategory> categories = EnumSet.noneOf(DiagnosisCategory.class);
        int skipped = 0;
        for (HospitalDiagnosis diagnosis : events) {
            if (DiagnosisCodeFormat.fromValue(diagnosis.getDiagnosisCodeFormat()) == null) {
                skipped++;
                log.debug("Skipping diagnosis {} with code format '{}' for hospitalization {}",
                    diagnosis.getDiagnosisCode(), diagnosis.getDiagnosisCodeFormat(), diagnosis.getHospitalizationId());
                continue;
            }
            categories.addAll(classifier.classify(diagnosis.getDiagnosisCode()));
        }
        report.record(DataQualityIssue.UNKNOWN_CODE_FORMAT, skipped);
        return new DiagnosisFeatures(categories, skipped);
    }
}
