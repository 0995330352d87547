package com.donorid.service.aggregation;

import com.donorid.model.clinical.LabResult;
import com.donorid.model.eligibility.DataQualityReport;
import com.donorid.model.enums.DataQualityIssue;
import com.donorid.model.enums.LabCategory;
import com.donorid.model.feature.FeatureValue;
import com.donorid.model.feature.LabFeatures;
import com.donorid.model.window.TimeWindow;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Worst value per organ quality lab inside the window. Every threshold is an upper bound, so worst is the maximum.
 * A lab with no plausible value in the window is unknown. Lab ranges only screen out non-physical values,
 * so an extreme result always reaches the maximum.
 */
public class LabAggregator implements EventAggregator<LabResult, LabFeatures> {

    private final PlausibleRangeFilter rangeFilter;

    public LabAggregator(PlausibleRangeFilter rangeFilter) {
        this.rangeFilter = rangeFilter;
    }

    @Override
    public LabFeatures reduce(List<LabResult> events, TimeWindow window, DataQualityReport report) {
        Map<LabCategory, Double> worst = new EnumMap<>(LabCategory.class);
        for (LabResult lab : events) {
            LabCategory category = LabCategory.fromValue(lab.getLabCategory());
            if (category == null || !window.contains(lab.getLabCollectDttm()) || lab.getLabValueNumeric() == null) {
                continue;
            }
            if (!rangeFilter.isPlausible(PlausibleRangeFilter.LABS, category.getValue(), lab.getLabValueNumeric())) {
                report.record(DataQualityIssue.IMPLAUSIBLE_VALUE);
                continue;
            }
            worst.merge(category, lab.getLabValueNumeric(), Math::max);
        }
        return new LabFeatures(
            FeatureValue.ofNullable(worst.get(LabCategory.CREATININE)),
            FeatureValue.ofNullable(worst.get(LabCategory.BILIRUBIN_TOTAL)),
            FeatureValue.ofNullable(worst.get(LabCategory.AST)),
            FeatureValue.ofNullable(worst.get(LabCategory.ALT))
        );
    }
}
