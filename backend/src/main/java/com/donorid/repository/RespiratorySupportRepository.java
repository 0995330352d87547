package com.donorid.repository;

import com.donorid.model.clinical.RespiratorySupport;
import org.springframework.stereotype.Repository;

/**
 * Repository for respiratory support rows.
 */
@Repository
public interface RespiratorySupportRepository extends HospitalizationScopedRepository<RespiratorySupport> {
}
