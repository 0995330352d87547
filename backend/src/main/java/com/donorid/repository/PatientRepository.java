package com.donorid.repository;

import com.donorid.model.clinical.Patient;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for patients.
 */
@Repository
public interface PatientRepository extends JpaRepository<Patient, String> {
}
