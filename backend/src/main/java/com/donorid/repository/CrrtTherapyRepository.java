package com.donorid.repository;

import com.donorid.model.clinical.CrrtTherapy;
import org.springframework.stereotype.Repository;

/**
 * Repository for CRRT therapy rows.
 */
@Repository
public interface CrrtTherapyRepository extends HospitalizationScopedRepository<CrrtTherapy> {
}
