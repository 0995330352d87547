package com.donorid.repository;

import com.donorid.model.clinical.AdtRecord;
import org.springframework.stereotype.Repository;

/**
 * Repository for ADT rows.
 */
@Repository
public interface AdtRepository extends HospitalizationScopedRepository<AdtRecord> {
}
