package com.donorid.repository;

import com.donorid.model.clinical.LabResult;
import org.springframework.stereotype.Repository;

/**
 * Repository for lab results.
 */
@Repository
public interface LabResultRepository extends HospitalizationScopedRepository<LabResult> {
}
