package com.donorid.service.aggregation;

import com.donorid.model.clinical.AdtRecord;
import com.donorid.model.clinical.HospitalDiagnosis;
import com.donorid.model.eligibility.DataQualityReport;
import com.donorid.model.enums.DataQualityIssue;
import com.donorid.model.enums.DiagnosisCategory;
import com.donorid.model.enums.LocationCategory;
import com.donorid.model.feature.DiagnosisFeatures;
import com.donorid.model.feature.LocationFeatures;
import com.donorid.model.window.TimeWindow;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.donorid.ClinicalFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boolean and categorical aggregators: respiratory support, microbiology, CRRT, diagnoses and ADT.
 */
class EventAggregatorsTest {

    private final TimeWindow lookback = TimeWindow.lookback(DEATH, Duration.ofHours(48));
    private final TimeWindow stay = new TimeWindow(ADMISSION, DEATH);

    @Test
    void imvCountsOnlyInsideLookback() {
        RespiratorySupportAggregator aggregator = new RespiratorySupportAggregator();
        DataQualityReport report = new DataQualityReport();

        assertThat(aggregator.reduce(List.of(respiratory("h1", DEATH.minusHours(40), "IMV")), lookback, report))
            .isTrue();
        assertThat(aggregator.reduce(List.of(respiratory("h1", DEATH.minusHours(50), "imv")), lookback, report))
            .isFalse();
        assertThat(aggregator.reduce(List.of(respiratory("h1", DEATH.minusHours(1), "nippv")), lookback, report))
            .isFalse();
    }

    @Test
    void positiveBloodCultureNeedsGrowthInsideLookback() {
        MicrobiologyAggregator aggregator = new MicrobiologyAggregator();
        DataQualityReport report = new DataQualityReport();

        assertThat(aggregator.reduce(List.of(culture("h1", DEATH.minusHours(10), "escherichia_coli")),
            lookback, report)).isTrue();
        assertThat(aggregator.reduce(List.of(culture("h1", DEATH.minusHours(10), "no_growth")),
            lookback, report)).isFalse();
        assertThat(aggregator.reduce(List.of(culture("h1", DEATH.minusHours(10), null)), lookback, report))
            .isFalse();
        assertThat(aggregator.reduce(List.of(culture("h1", DEATH.minusDays(5), "escherichia_coli")),
            lookback, report)).isFalse();
    }

    @Test
    void crrtAnywhereInStayCounts() {
        CrrtAggregator aggregator = new CrrtAggregator();

        assertThat(aggregator.reduce(List.of(crrt("h1", ADMISSION.minusDays(30))), lookback,
            new DataQualityReport())).isTrue();
        assertThat(aggregator.reduce(List.of(), lookback, new DataQualityReport())).isFalse();
    }

    @Test
    void diagnosesSkipUnknownFormats() {
        DiagnosisAggregator aggregator = new DiagnosisAggregator(classifier());
        HospitalDiagnosis icd9 = diagnosis("h1", "410.71");
        icd9.setDiagnosisCodeFormat("icd9");
        DataQualityReport report = new DataQualityReport();

        DiagnosisFeatures features = aggregator.reduce(List.of(
            diagnosis("h1", "I61.9"),
            diagnosis("h1", "C34.90"),
            icd9), stay, report);

        assertThat(features.categories())
            .containsExactlyInAnyOrder(DiagnosisCategory.CEREBROVASCULAR, DiagnosisCategory.ACTIVE_CANCER);
        assertThat(features.hasQualifyingCause()).isTrue();
        assertThat(features.hasContraindication()).isTrue();
        assertThat(features.skippedRecords()).isEqualTo(1);
        assertThat(report.count(DataQualityIssue.UNKNOWN_CODE_FORMAT)).isEqualTo(1);
    }

    @Test
    void locationAtDeathFallsBackToLatestPriorRow() {
        AdtAggregator aggregator = new AdtAggregator();
        List<AdtRecord> rows = List.of(
            adt("h1", ADMISSION, ADMISSION.plusHours(6), "ed"),
            adt("h1", ADMISSION.plusHours(6), DEATH.minusDays(1), "stepdown"));

        LocationFeatures features = aggregator.reduce(rows, stay, new DataQualityReport());

        assertThat(features.locationAtDeath().get()).isEqualTo(LocationCategory.STEPDOWN);
        assertThat(features.firstAdmissionLocation().get()).isEqualTo(LocationCategory.ED);
        assertThat(features.firstIcuLengthOfStayDays().isKnown()).isFalse();
        assertThat(features.everIn(LocationCategory.ICU)).isFalse();
    }

    @Test
    void locationAfterDeathIsIgnored() {
        AdtAggregator aggregator = new AdtAggregator();
        List<AdtRecord> rows = List.of(
            adt("h1", ADMISSION, DEATH, "hospice"),
            adt("h1", DEATH.plusMinutes(30), DEATH.plusHours(2), "other"));

        LocationFeatures features = aggregator.reduce(rows, stay, new DataQualityReport());

        assertThat(features.locationAtDeath().get()).isEqualTo(LocationCategory.HOSPICE);
        assertThat(features.locationsVisited()).contains(LocationCategory.OTHER);
    }

    @Test
    void noAdtRowsMeansUnknownLocation() {
        LocationFeatures features = new AdtAggregator().reduce(List.of(), stay, new DataQualityReport());

        assertThat(features.locationAtDeath().isKnown()).isFalse();
    }
}
