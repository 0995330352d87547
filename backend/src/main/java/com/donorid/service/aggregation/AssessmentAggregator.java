package com.donorid.service.aggregation;

import com.donorid.model.clinical.PatientAssessment;
import com.donorid.model.eligibility.DataQualityReport;
import com.donorid.model.enums.AssessmentCategory;
import com.donorid.model.enums.DataQualityIssue;
import com.donorid.model.feature.AssessmentFeatures;
import com.donorid.model.feature.FeatureValue;
import com.donorid.model.window.TimeWindow;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Most recent GCS total and RASS inside the window. Not used by any criterion.
 */
public class AssessmentAggregator implements EventAggregator<PatientAssessment, AssessmentFeatures> {

    private final PlausibleRangeFilter rangeFilter;

    public AssessmentAggregator(PlausibleRangeFilter rangeFilter) {
        this.rangeFilter = rangeFilter;
    }

    @Override
    public AssessmentFeatures reduce(List<PatientAssessment> events, TimeWindow window, DataQualityReport report) {
        Map<AssessmentCategory, PatientAssessment> latest = new EnumMap<>(AssessmentCategory.class);
        for (PatientAssessment assessment : events) {
            AssessmentCategory category = AssessmentCategory.fromValue(assessment.getAssessmentCategory());
            if (category == null || !window.contains(assessment.getRecordedDttm())
                    || assessment.getNumericalValue() == null) {
                continue;
            }
            if (!rangeFilter.isPlausible(PlausibleRangeFilter.ASSESSMENTS, category.getValue(),
                    assessment.getNumericalValue())) {
                report.record(DataQualityIssue.IMPLAUSIBLE_VALUE);
                continue;
            }
            latest.merge(category, assessment, (current, candidate) -> {
                int cmp = candidate.getRecordedDttm().compareTo(current.getRecordedDttm());
                if (cmp != 0) {
                    return cmp > 0 ? candidate : current;
                }
                return candidate.getNumericalValue() < current.getNumericalValue() ? candidate : current;
            });
        }
        return new AssessmentFeatures(
            valueOf(latest.get(AssessmentCategory.GCS_TOTAL)),
            valueOf(latest.get(AssessmentCategory.RASS)));
    }

    private static FeatureValue<Double> valueOf(PatientAssessment assessment) {
        return assessment == null ? FeatureValue.unknown() : FeatureValue.known(assessment.getNumericalValue());
    }
}
