package com.donorid.service.aggregation;

import com.donorid.model.clinical.MicrobiologyCulture;
import com.donorid.model.eligibility.DataQualityReport;
import com.donorid.model.window.TimeWindow;

import java.util.List;
import java.util.Locale;

/**
 * True when a blood (buffy coat) culture collected inside the window grew an organism.
 * A null, blank or no_growth organism is a negative culture.
 */
public class MicrobiologyAggregator implements EventAggregator<MicrobiologyCulture, Boolean> {

    public static final String BLOOD_BUFFY = "blood_buffy";
    public static final String CULTURE = "culture";
    public static final String NO_GROWTH = "no_growth";

    @Override
    public Boolean reduce(List<MicrobiologyCulture> events, TimeWindow window, DataQualityReport report) {
        return events.stream()
            .filter(c -> window.contains(c.getCollectDttm()))
            .filter(c -> BLOOD_BUFFY.equals(lower(c.getFluidCategory())))
            .filter(c -> CULTURE.equals(lower(c.getMethodCategory())))
            .anyMatch(MicrobiologyAggregator::isPositive);
    }

    static boolean isPositive(MicrobiologyCulture culture) {
        String organism = lower(culture.getOrganismCategory());
        return !organism.isEmpty() && !organism.contains(NO_GROWTH);
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
