package com.donorid.repository;

import com.donorid.model.clinical.VitalSign;
import org.springframework.stereotype.Repository;

/**
 * Repository for vital signs.
 */
@Repository
public interface VitalSignRepository extends HospitalizationScopedRepository<VitalSign> {
}
