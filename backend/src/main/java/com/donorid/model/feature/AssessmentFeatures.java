package com.donorid.model.feature;

/**
 * Last GCS total and RASS at or before death. Descriptive only.
 */
public record AssessmentFeatures(FeatureValue<Double> gcsTotal, FeatureValue<Double> rass) {

    public static AssessmentFeatures none() {
        return new AssessmentFeatures(FeatureValue.unknown(), FeatureValue.unknown());
    }
}
