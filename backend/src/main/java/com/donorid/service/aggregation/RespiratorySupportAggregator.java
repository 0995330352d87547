package com.donorid.service.aggregation;

import com.donorid.model.clinical.RespiratorySupport;
import com.donorid.model.eligibility.DataQualityReport;
import com.donorid.model.window.TimeWindow;

import java.util.List;

/**
 * True when any invasive mechanical ventilation row falls inside the window.
 */
public class RespiratorySupportAggregator implements EventAggregator<RespiratorySupport, Boolean> {

    public static final String IMV = "imv";

    @Override
    public Boolean reduce(List<RespiratorySupport> events, TimeWindow window, DataQualityReport report) {
        return events.stream()
            .anyMatch(r -> r.getDeviceCategory() != null
                && IMV.equalsIgnoreCase(r.getDeviceCategory().trim())
                && window.contains(r.getRecordedDttm()));
    }
}
