package com.donorid.repository;

import com.donorid.model.clinical.Hospitalization;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for hospitalizations.
 */
@Repository
public interface HospitalizationRepository extends JpaRepository<Hospitalization, String> {

    long countByDischargeCategoryIgnoreCase(String dischargeCategory);
}
