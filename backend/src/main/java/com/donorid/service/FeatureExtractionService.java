package com.donorid.service;

import com.donorid.dataset.ClinicalDataset;
import com.donorid.exception.MissingTimestampException;
import com.donorid.model.clinical.Hospitalization;
import com.donorid.model.clinical.Patient;
import com.donorid.model.eligibility.DataQualityReport;
import com.donorid.model.enums.DataQualityIssue;
import com.donorid.model.feature.*;
import com.donorid.model.window.ResolvedWindows;
import com.donorid.model.window.TimeWindow;
import com.donorid.service.aggregation.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Builds the feature record of one hospitalization by running every aggregator over its rows.
 * <p>
 * Only expired hospitalizations with a resolvable death time get event features; all others carry
 * demographics and age, with every event feature unknown.
 */
@Service
@Slf4j
public class FeatureExtractionService {

    static final double DAYS_PER_YEAR = 365.25;

    private final TemporalWindowResolver windowResolver;
    private final LabAggregator labAggregator;
    private final VitalsAggregator vitalsAggregator;
    private final RespiratorySupportAggregator respiratorySupportAggregator;
    private final MicrobiologyAggregator microbiologyAggregator;
    private final CrrtAggregator crrtAggregator;
    private final DiagnosisAggregator diagnosisAggregator;
    private final AssessmentAggregator assessmentAggregator;
    private final AdtAggregator adtAggregator;

    public FeatureExtractionService(
            TemporalWindowResolver windowResolver,
            LabAggregator labAggregator,
            VitalsAggregator vitalsAggregator,
            RespiratorySupportAggregator respiratorySupportAggregator,
            MicrobiologyAggregator microbiologyAggregator,
            CrrtAggregator crrtAggregator,
            DiagnosisAggregator diagnosisAggregator,
            AssessmentAggregator assessmentAggregator,
            AdtAggregator adtAggregator) {
        this.windowResolver = windowResolver;
        this.labAggregator = labAggregator;
        this.vitalsAggregator = vitalsAggregator;
        this.respiratorySupportAggregator = respiratorySupportAggregator;
        this.microbiologyAggregator = microbiologyAggregator;
        this.crrtAggregator = crrtAggregator;
        this.diagnosisAggregator = diagnosisAggregator;
        this.assessmentAggregator = assessmentAggregator;
        this.adtAggregator = adtAggregator;
    }

    /**
     * @param patient the patient row, or null when it is missing
     */
    public FeatureRecord extract(Hospitalization hospitalization, Patient patient,
                                 ClinicalDataset dataset, DataQualityReport report) {
        String id = hospitalization.getHospitalizationId();
        if (patient == null) {
            report.record(DataQualityIssue.MISSING_REQUIRED_FIELD);
            log.debug("No patient row for hospitalization {}", id);
        }
        if (!hospitalization.isExpired()) {
            return baseRecord(hospitalization, patient, dataset, false)
                .ageYears(ageAt(patient, hospitalization.getDischargeDttm()))
                .build();
        }

        ResolvedWindows windows;
        try {
            windows = windowResolver.resolve(hospitalization, patient);
        } catch (MissingTimestampException e) {
            report.record(DataQualityIssue.MISSING_TIMESTAMP);
            log.warn(e.getMessage());
            return baseRecord(hospitalization, patient, dataset, true).build();
        }

        LocalDateTime death = windows.deathTime();
        FeatureValue<Double> age = ageAt(patient, death);
        // A missing patient row was already counted
        if (!age.isKnown() && patient != null) {
            report.record(DataQualityIssue.MISSING_REQUIRED_FIELD);
        }
        TimeWindow untilDeath = new TimeWindow(windows.lifetime().start(), death);

        return baseRecord(hospitalization, patient, dataset, true)
            .deathTime(FeatureValue.known(death))
            .ageYears(age)
            .labs(labAggregator.reduce(dataset.getLabs().findByHospitalization(id), windows.lifetime(), report))
            .vitals(vitalsAggregator.reduce(dataset.getVitals().findByHospitalization(id), untilDeath, report))
            .imvWithinLookback(respiratorySupportAggregator.reduce(
                dataset.getRespiratorySupport().findByHospitalization(id), windows.imv(), report))
            .positiveBloodCulture(microbiologyAggregator.reduce(
                dataset.getMicrobiology().findByHospitalization(id), windows.culture(), report))
            .crrtDuringStay(crrtAggregator.reduce(dataset.getCrrt().findByHospitalization(id), windows.lifetime(), report))
            .diagnoses(diagnosisAggregator.reduce(dataset.findDiagnoses(id), windows.lifetime(), report))
            .assessments(assessmentAggregator.reduce(
                dataset.getAssessments().findByHospitalization(id), untilDeath, report))
            .location(adtAggregator.reduce(dataset.getAdt().findByHospitalization(id), untilDeath, report))
            .build();
    }

    private static FeatureRecord.FeatureRecordBuilder baseRecord(Hospitalization hospitalization, Patient patient,
                                                                 ClinicalDataset dataset, boolean expired) {
        return FeatureRecord.builder()
            .hospitalizationId(hospitalization.getHospitalizationId())
            .sourceHospitalizationIds(dataset.findMemberIds(hospitalization.getHospitalizationId()))
            .patientId(hospitalization.getPatientId())
            .expired(expired)
            .deathTime(FeatureValue.unknown())
            .admissionTime(hospitalization.getAdmissionDttm())
            .ageYears(FeatureValue.unknown())
            .raceCategory(patient != null ? patient.getRaceCategory() : null)
            .ethnicityCategory(patient != null ? patient.getEthnicityCategory() : null)
            .sexCategory(patient != null ? patient.getSexCategory() : null)
            .labs(LabFeatures.none())
            .vitals(VitalFeatures.none())
            .diagnoses(DiagnosisFeatures.none())
            .assessments(AssessmentFeatures.none())
            .location(LocationFeatures.none());
    }

    /**
     * Age in years from birth date to the reference time: elapsed days / 365.25.
     * Unknown when either end is missing or the reference precedes birth.
     */
    static FeatureValue<Double> ageAt(Patient patient, LocalDateTime reference) {
        if (patient == null || patient.getBirthDate() == null || reference == null) {
            return FeatureValue.unknown();
        }
        LocalDate birth = patient.getBirthDate();
        long days = ChronoUnit.DAYS.between(birth, reference.toLocalDate());
        if (days < 0) {
            return FeatureValue.unknown();
        }
        return FeatureValue.known(days / DAYS_PER_YEAR);
    }
}
