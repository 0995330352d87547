package com.donorid.repository;

import com.donorid.model.clinical.HospitalDiagnosis;
import org.springframework.stereotype.Repository;

/**
 * Repository for hospital diagnoses.
 */
@Repository
public interface HospitalDiagnosisRepository extends HospitalizationScopedRepository<HospitalDiagnosis> {
}
