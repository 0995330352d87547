package com.donorid.repository;

import com.donorid.model.run.CohortRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for persisted cohort runs.
 */
@Repository
public interface CohortRunRepository extends JpaRepository<CohortRun, Long> {

    List<CohortRun> findAllByOrderByExecutedAtDesc();

    List<CohortRun> findBySiteNameOrderByExecutedAtDesc(String siteName);
}
