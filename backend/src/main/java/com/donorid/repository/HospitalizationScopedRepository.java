package com.donorid.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.repository.NoRepositoryBean;

import java.util.Collection;
import java.util.List;

/**
 * Base repository for event tables keyed by hospitalization_id.
 */
@NoRepositoryBean
public interface HospitalizationScopedRepository<T> extends JpaRepository<T, Long> {

    /**
     * Find all rows of the given hospitalizations.
     */
    List<T> findByHospitalizationIdIn(Collection<String> hospitalizationIds);
}
