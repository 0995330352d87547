package com.donorid.dataset;

import com.donorid.model.clinical.ClinicalEvent;

import java.util.List;

/**
 * Read access to an event table by hospitalization. Windowing is left to the aggregators.
 */
public interface EventTable<E extends ClinicalEvent> {

    /**
     * All rows of the hospitalization ordered by event time, rows without a time last.
     */
    List<E> findByHospitalization(String hospitalizationId);

    boolean containsHospitalization(String hospitalizationId);

    int size();
}
