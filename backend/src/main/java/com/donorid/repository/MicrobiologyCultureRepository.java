package com.donorid.repository;

import com.donorid.model.clinical.MicrobiologyCulture;
import org.springframework.stereotype.Repository;

/**
 * Repository for microbiology cultures.
 */
@Repository
public interface MicrobiologyCultureRepository extends HospitalizationScopedRepository<MicrobiologyCulture> {
}
