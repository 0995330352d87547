package com.donorid.service.aggregation;

import com.donorid.model.eligibility.DataQualityReport;
import com.donorid.model.feature.FeatureValue;
import com.donorid.model.feature.VitalFeatures;
import com.donorid.model.window.TimeWindow;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.donorid.ClinicalFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class VitalsAggregatorTest {

    private final VitalsAggregator aggregator = new VitalsAggregator(rangeFilter());
    private final TimeWindow untilDeath = new TimeWindow(ADMISSION, DEATH);

    @Test
    void usesMostRecentObservationAtOrBeforeDeath() {
        VitalFeatures features = aggregator.reduce(List.of(
            vital("h1", ADMISSION, "weight_kg", 90.0),
            vital("h1", DEATH.minusDays(1), "weight_kg", 80.0),
            vital("h1", DEATH.plusHours(2), "weight_kg", 60.0),
            vital("h1", ADMISSION, "height_cm", 160.0),
            vital("h1", DEATH.minusDays(1), "heart_rate", 120.0)
        ), untilDeath, new DataQualityReport());

        assertThat(features.weightKg().get()).isEqualTo(80.0);
        assertThat(features.heightCm().get()).isEqualTo(160.0);
        assertThat(features.bmi().get()).isCloseTo(31.25, within(1e-9));
        assertThat(features.firstRecorded().get()).isEqualTo(ADMISSION);
        assertThat(features.lastRecorded().get()).isEqualTo(DEATH.plusHours(2));
    }

    @Test
    void bmiIsUnknownWithoutHeight() {
        VitalFeatures features = aggregator.reduce(List.of(vital("h1", DEATH, "weight_kg", 80.0)), untilDeath,
            new DataQualityReport());

        assertThat(features.weightKg().isKnown()).isTrue();
        assertThat(features.bmi().isKnown()).isFalse();
    }

    @Test
    void bmiIsUnknownForNonPositiveHeight() {
        assertThat(VitalsAggregator.bmi(FeatureValue.known(70.0), FeatureValue.known(0.0)).isKnown()).isFalse();
        assertThat(VitalsAggregator.bmi(FeatureValue.known(70.0), FeatureValue.unknown()).isKnown()).isFalse();
    }

    @Test
    void simultaneousObservationsKeepTheLargerValue() {
        VitalFeatures features = aggregator.reduce(List.of(
            vital("h1", DEATH, "weight_kg", 70.0),
            vital("h1", DEATH, "weight_kg", 72.0)
        ), untilDeath, new DataQualityReport());

        assertThat(features.weightKg().get()).isEqualTo(72.0);
    }
}
