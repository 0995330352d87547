package com.donorid.service.aggregation;

import com.donorid.model.clinical.CrrtTherapy;
import com.donorid.model.eligibility.DataQualityReport;
import com.donorid.model.window.TimeWindow;

import java.util.List;

/**
 * True when the hospitalization has any CRRT row. The window is ignored: CRRT anywhere in the stay counts.
 */
public class CrrtAggregator implements EventAggregator<CrrtTherapy, Boolean> {

    @Override
    public Boolean reduce(List<CrrtTherapy> events, TimeWindow window, DataQualityReport report) {
        return !events.isEmpty();
    }
}
