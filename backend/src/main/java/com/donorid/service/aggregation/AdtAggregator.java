package com.donorid.service.aggregation;

import com.donorid.model.clinical.AdtRecord;
import com.donorid.model.eligibility.DataQualityReport;
import com.donorid.model.enums.LocationCategory;
import com.donorid.model.feature.FeatureValue;
import com.donorid.model.feature.LocationFeatures;
import com.donorid.model.window.TimeWindow;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Location features of a stay. The window end is the death time.
 * <p>
 * Location at death is the row whose [in, out] interval contains the death time; failing that, the row with the
 * latest in time at or before death. Length of stay runs from the first in to the last out.
 */
public class AdtAggregator implements EventAggregator<AdtRecord, LocationFeatures> {

    private static final double SECONDS_PER_DAY = 86_400.0;

    @Override
    public LocationFeatures reduce(List<AdtRecord> events, TimeWindow window, DataQualityReport report) {
        if (events.isEmpty()) {
            return LocationFeatures.none();
        }
        LocalDateTime deathTime = window.end();
        Set<LocationCategory> visited = EnumSet.noneOf(LocationCategory.class);
        AdtRecord containing = null;
        AdtRecord latestPrior = null;
        AdtRecord first = null;
        LocalDateTime lastOut = null;

        for (AdtRecord adt : events) {
            if (adt.getLocationCategory() != null) {
                visited.add(LocationCategory.fromValue(adt.getLocationCategory()));
            }
            LocalDateTime in = adt.getInDttm();
            if (in == null) {
                continue;
            }
            if (first == null || in.isBefore(first.getInDttm())) {
                first = adt;
            }
            if (adt.getOutDttm() != null && (lastOut == null || adt.getOutDttm().isAfter(lastOut))) {
                lastOut = adt.getOutDttm();
            }
            if (in.isAfter(deathTime)) {
                continue;
            }
            // Rows are sorted by in time, so later matches replace earlier ones
            if (adt.getOutDttm() != null && !deathTime.isAfter(adt.getOutDttm())) {
                containing = adt;
            }
            latestPrior = adt;
        }

        AdtRecord atDeath = containing != null ? containing : latestPrior;
        return new LocationFeatures(
            locationOf(atDeath),
            visited,
            locationOf(first),
            first != null && lastOut != null && !lastOut.isBefore(first.getInDttm())
                ? FeatureValue.known(days(first.getInDttm(), lastOut))
                : FeatureValue.unknown(),
            firstIcuStayDays(events)
        );
    }

    private static FeatureValue<Double> firstIcuStayDays(List<AdtRecord> events) {
        for (AdtRecord adt : events) {
            if (LocationCategory.fromValue(adt.getLocationCategory()) == LocationCategory.ICU
                    && adt.getInDttm() != null) {
                if (adt.getOutDttm() == null || adt.getOutDttm().isBefore(adt.getInDttm())) {
                    return FeatureValue.unknown();
                }
                return FeatureValue.known(days(adt.getInDttm(), adt.getOutDttm()));
            }
        }
        return FeatureValue.unknown();
    }

    private static FeatureValue<LocationCategory> locationOf(AdtRecord adt) {
        if (adt == null || adt.getLocationCategory() == null) {
            return FeatureValue.unknown();
        }
        return FeatureValue.known(LocationCategory.fromValue(adt.getLocationCategory()));
    }

    private static double days(LocalDateTime from, LocalDateTime to) {
        return Duration.between(from, to).getSeconds() / SECONDS_PER_DAY;
    }
}
