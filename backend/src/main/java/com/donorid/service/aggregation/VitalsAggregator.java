package com.donorid.service.aggregation;

import com.donorid.model.clinical.VitalSign;
import com.donorid.model.eligibility.DataQualityReport;
import com.donorid.model.enums.DataQualityIssue;
import com.donorid.model.enums.VitalCategory;
import com.donorid.model.feature.FeatureValue;
import com.donorid.model.feature.VitalFeatures;
import com.donorid.model.window.TimeWindow;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Nearest prior observation of weight and height at or before the window end (the death time), and BMI from them.
 * First and last vital timestamps cover the whole stay.
 */
public class VitalsAggregator implements EventAggregator<VitalSign, VitalFeatures> {

    private final PlausibleRangeFilter rangeFilter;

    public VitalsAggregator(PlausibleRangeFilter rangeFilter) {
        this.rangeFilter = rangeFilter;
    }

    @Override
    public VitalFeatures reduce(List<VitalSign> events, TimeWindow window, DataQualityReport report) {
        Map<VitalCategory, VitalSign> latest = new EnumMap<>(VitalCategory.class);
        LocalDateTime first = null;
        LocalDateTime last = null;
        for (VitalSign vital : events) {
            LocalDateTime recorded = vital.getRecordedDttm();
            if (recorded != null) {
                first = first == null || recorded.isBefore(first) ? recorded : first;
                last = last == null || recorded.isAfter(last) ? recorded : last;
            }
            VitalCategory category = VitalCategory.fromValue(vital.getVitalCategory());
            if (category == null || !window.contains(recorded) || vital.getVitalValue() == null) {
                continue;
            }
            if (!rangeFilter.isPlausible(PlausibleRangeFilter.VITALS, category.getValue(), vital.getVitalValue())) {
                report.record(DataQualityIssue.IMPLAUSIBLE_VALUE);
                continue;
            }
            latest.merge(category, vital, VitalsAggregator::later);
        }
        FeatureValue<Double> weight = valueOf(latest.get(VitalCategory.WEIGHT_KG));
        FeatureValue<Double> height = valueOf(latest.get(VitalCategory.HEIGHT_CM));
        return new VitalFeatures(weight, height, bmi(weight, height),
            FeatureValue.ofNullable(first), FeatureValue.ofNullable(last));
    }

    /**
     * weight_kg / (height_cm / 100)^2, unknown if either input is unknown or height is not positive.
     */
    static FeatureValue<Double> bmi(FeatureValue<Double> weightKg, FeatureValue<Double> heightCm) {
        if (!weightKg.isKnown() || !heightCm.isKnown() || heightCm.get() <= 0) {
            return FeatureValue.unknown();
        }
        double heightM = heightCm.get() / 100.0;
        return FeatureValue.known(weightKg.get() / (heightM * heightM));
    }

    // Equal timestamps keep the larger value so the result does not depend on row order
    private static VitalSign later(VitalSign current, VitalSign candidate) {
        int cmp = candidate.getRecordedDttm().compareTo(current.getRecordedDttm());
        if (cmp != 0) {
            return cmp > 0 ? candidate : current;
        }
        return candidate.getVitalValue() > current.getVitalValue() ? candidate : current;
    }

    private static FeatureValue<Double> valueOf(VitalSign vital) {
        return vital == null ? FeatureValue.unknown() : FeatureValue.known(vital.getVitalValue());
    }
}
