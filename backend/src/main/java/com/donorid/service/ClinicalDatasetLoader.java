package com.donorid.service;

import com.donorid.dataset.ClinicalDataset;
import com.donorid.dataset.EncounterStitcher;
import com.donorid.model.clinical.Hospitalization;
import com.donorid.model.enums.RepeatDecedentPolicy;
import com.donorid.repository.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reads the ten source tables into an in-memory {@link ClinicalDataset}.
 * <p>
 * Patients and hospitalizations are always read in full. Event rows are by default read only for the
 * hospitalizations of patients who died in hospital: only expired stays get event features, and a stay of the
 * same patient may be stitched onto one.
 */
@Service
@Slf4j
public class ClinicalDatasetLoader {

    static final int ID_CHUNK_SIZE = 1000;

    private final PatientRepository patientRepository;
    private final HospitalizationRepository hospitalizationRepository;
    private final AdtRepository adtRepository;
    private final LabResultRepository labResultRepository;
    private final VitalSignRepository vitalSignRepository;
    private final RespiratorySupportRepository respiratorySupportRepository;
    private final MicrobiologyCultureRepository microbiologyCultureRepository;
    private final CrrtTherapyRepository crrtTherapyRepository;
    private final PatientAssessmentRepository patientAssessmentRepository;
    private final HospitalDiagnosisRepository hospitalDiagnosisRepository;

    @Value("${donor.loader.expired-only:true}")
    private boolean expiredOnly;

    @Value("${donor.stitching.enabled:true}")
    private boolean stitchingEnabled;

    @Value("${donor.stitching.window-hours:12}")
    private long stitchingWindowHours;

    @Value("${donor.repeat-decedents:evaluate-all}")
    private String repeatDecedents;

    public ClinicalDatasetLoader(
            PatientRepository patientRepository,
            HospitalizationRepository hospitalizationRepository,
            AdtRepository adtRepository,
            LabResultRepository labResultRepository,
            VitalSignRepository vitalSignRepository,
            RespiratorySupportRepository respiratorySupportRepository,
            MicrobiologyCultureRepository microbiologyCultureRepository,
            CrrtTherapyRepository crrtTherapyRepository,
            PatientAssessmentRepository patientAssessmentRepository,
            HospitalDiagnosisRepository hospitalDiagnosisRepository) {
        this.patientRepository = patientRepository;
        this.hospitalizationRepository = hospitalizationRepository;
        this.adtRepository = adtRepository;
        this.labResultRepository = labResultRepository;
        this.vitalSignRepository = vitalSignRepository;
        this.respiratorySupportRepository = respiratorySupportRepository;
        this.microbiologyCultureRepository = microbiologyCultureRepository;
        this.crrtTherapyRepository = crrtTherapyRepository;
        this.patientAssessmentRepository = patientAssessmentRepository;
        this.hospitalDiagnosisRepository = hospitalDiagnosisRepository;
    }

    @Transactional(readOnly = true)
    public ClinicalDataset load() {
        List<Hospitalization> hospitalizations = hospitalizationRepository.findAll();
        log.info("Loading dataset: {} hospitalizations ({} expired), expired-only event rows: {}",
            hospitalizations.size(),
            hospitalizationRepository.countByDischargeCategoryIgnoreCase(Hospitalization.EXPIRED),
            expiredOnly);

        Set<String> decedents = hospitalizations.stream()
            .filter(Hospitalization::isExpired)
            .map(Hospitalization::getPatientId)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
        List<String> ids = hospitalizations.stream()
            .filter(h -> h.getHospitalizationId() != null)
            .filter(h -> !expiredOnly || decedents.contains(h.getPatientId()))
            .map(Hospitalization::getHospitalizationId)
            .toList();

        EncounterStitcher stitcher = stitchingEnabled
            ? new EncounterStitcher(Duration.ofHours(stitchingWindowHours))
            : EncounterStitcher.disabled();
        ClinicalDataset dataset = ClinicalDataset.builder()
            .patients(patientRepository.findAll())
            .hospitalizations(hospitalizations)
            .stitcher(stitcher)
            .repeatDecedentPolicy(RepeatDecedentPolicy.fromValue(repeatDecedents))
            .adt(fetch(adtRepository, ids))
            .labs(fetch(labResultRepository, ids))
            .vitals(fetch(vitalSignRepository, ids))
            .respiratorySupport(fetch(respiratorySupportRepository, ids))
            .microbiology(fetch(microbiologyCultureRepository, ids))
            .crrt(fetch(crrtTherapyRepository, ids))
            .assessments(fetch(patientAssessmentRepository, ids))
            .diagnoses(fetch(hospitalDiagnosisRepository, ids))
            .build();

        log.info("Loaded {} patients, adt={}, labs={}, vitals={}, respiratory_support={}, microbiology_culture={}, "
                + "crrt_therapy={}, patient_assessments={}",
            dataset.getPatientCount(), dataset.getAdt().size(), dataset.getLabs().size(), dataset.getVitals().size(),
            dataset.getRespiratorySupport().size(), dataset.getMicrobiology().size(), dataset.getCrrt().size(),
            dataset.getAssessments().size());
        if (stitcher.isEnabled()) {
            log.info("Stitched {} encounter blocks within {} hours", dataset.getStitchedBlockCount(),
                stitchingWindowHours);
        }
        return dataset;
    }

    private <T> List<T> fetch(HospitalizationScopedRepository<T> repository, List<String> ids) {
        if (!expiredOnly) {
            return repository.findAll();
        }
        List<T> rows = new ArrayList<>();
        for (int from = 0; from < ids.size(); from += ID_CHUNK_SIZE) {
            rows.addAll(repository.findByHospitalizationIdIn(ids.subList(from, Math.min(from + ID_CHUNK_SIZE, ids.size()))));
        }
        return rows;
    }
}
