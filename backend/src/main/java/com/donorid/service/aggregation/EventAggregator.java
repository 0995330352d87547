package com.donorid.service.aggregation;

import com.donorid.model.eligibility.DataQualityReport;
import com.donorid.model.window.TimeWindow;

import java.util.List;

/**
 * Folds every row one hospitalization has in a source table into a single feature.
 * Missing data never raises: it is represented as an unknown feature.
 *
 * @param <E> source row type
 * @param <F> feature type
 */
public interface EventAggregator<E, F> {

    /**
     * @param events all rows of the hospitalization, ordered by event time
     * @param window window the aggregator scopes rows to; its policy decides how the window applies
     * @param report sink for data-quality counts
     */
    F reduce(List<E> events, TimeWindow window, DataQualityReport report);
}
