package com.donorid.model.feature;

import java.time.LocalDateTime;

/**
 * Most recent weight and height at or before death, and the BMI derived from them.
 */
public record VitalFeatures(
    FeatureValue<Double> weightKg,
    FeatureValue<Double> heightCm,
    FeatureValue<Double> bmi,
    FeatureValue<LocalDateTime> firstRecorded,
    FeatureValue<LocalDateTime> lastRecorded
) {

    public static VitalFeatures none() {
        return new VitalFeatures(FeatureValue.unknown(), FeatureValue.unknown(), FeatureValue.unknown(),
            FeatureValue.unknown(), FeatureValue.unknown());
    }
}
