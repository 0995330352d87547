package com.donorid.service.aggregation;

import com.donorid.model.clinical.LabResult;
import com.donorid.model.eligibility.DataQualityReport;
import com.donorid.model.enums.DataQualityIssue;
import com.donorid.model.feature.LabFeatures;
import com.donorid.model.window.TimeWindow;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.donorid.ClinicalFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class LabAggregatorTest {

    private final LabAggregator aggregator = new LabAggregator(rangeFilter());
    private final TimeWindow stay = new TimeWindow(ADMISSION, DEATH);

    @Test
    void takesMaximumPerCategoryInsideWindow() {
        List<LabResult> labs = List.of(
            lab("h1", ADMISSION.plusHours(2), "creatinine", 1.2),
            lab("h1", DEATH.minusHours(2), "creatinine", 3.1),
            lab("h1", DEATH.minusHours(1), "creatinine", 2.0),
            lab("h1", DEATH.plusHours(1), "creatinine", 9.0),
            lab("h1", DEATH.minusHours(1), "Bilirubin_Total", 1.4));

        LabFeatures features = aggregator.reduce(labs, stay, new DataQualityReport());

        assertThat(features.creatinine().get()).isEqualTo(3.1);
        assertThat(features.bilirubinTotal().get()).isEqualTo(1.4);
        assertThat(features.ast().isKnown()).isFalse();
        assertThat(features.alt().isKnown()).isFalse();
    }

    @Test
    void resultDoesNotDependOnRowOrder() {
        List<LabResult> labs = List.of(
            lab("h1", DEATH.minusHours(3), "ast", 40.0),
            lab("h1", DEATH.minusHours(3), "ast", 650.0),
            lab("h1", DEATH.minusHours(2), "ast", 80.0));

        List<LabResult> reversedRows = new ArrayList<>(labs);
        Collections.reverse(reversedRows);

        DataQualityReport report = new DataQualityReport();
        LabFeatures forward = aggregator.reduce(labs, stay, report);
        LabFeatures reversed = aggregator.reduce(reversedRows, stay, report);

        assertThat(forward).isEqualTo(reversed);
        assertThat(forward.ast().get()).isEqualTo(650.0);
    }

    @Test
    void negativeValuesAreDroppedAndCounted() {
        DataQualityReport report = new DataQualityReport();
        List<LabResult> labs = List.of(
            lab("h1", DEATH.minusHours(3), "creatinine", -1.0),
            lab("h1", DEATH.minusHours(1), "creatinine", null));

        LabFeatures features = aggregator.reduce(labs, stay, report);

        assertThat(features.creatinine().isKnown()).isFalse();
        assertThat(report.count(DataQualityIssue.IMPLAUSIBLE_VALUE)).isEqualTo(1);
    }

    @Test
    void extremeValuesStillCountTowardsTheMaximum() {
        DataQualityReport report = new DataQualityReport();
        List<LabResult> labs = List.of(
            lab("h1", ADMISSION.plusHours(4), "creatinine", 3.5),
            lab("h1", DEATH.minusHours(6), "creatinine", 25.0),
            lab("h1", DEATH.minusHours(6), "bilirubin_total", 120.0),
            lab("h1", DEATH.minusHours(6), "alt", 30000.0));

        LabFeatures features = aggregator.reduce(labs, stay, report);

        assertThat(features.creatinine().get()).isEqualTo(25.0);
        assertThat(features.bilirubinTotal().get()).isEqualTo(120.0);
        assertThat(features.alt().get()).isEqualTo(30000.0);
        assertThat(report.count(DataQualityIssue.IMPLAUSIBLE_VALUE)).isZero();
    }
}
