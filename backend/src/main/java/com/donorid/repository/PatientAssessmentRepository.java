package com.donorid.repository;

import com.donorid.model.clinical.PatientAssessment;
import org.springframework.stereotype.Repository;

/**
 * Repository for patient assessments.
 */
@Repository
public interface PatientAssessmentRepository extends HospitalizationScopedRepository<PatientAssessment> {
}
