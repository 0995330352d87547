package com.donorid.model.feature;

import com.donorid.model.enums.LabCategory;

/**
 * Worst (maximum) value per organ quality lab over the stay.
 */
public record LabFeatures(
    FeatureValue<Double> creatinine,
    FeatureValue<Double> bilirubinTotal,
    FeatureValue<Double> ast,
    FeatureValue<Double> alt
) {

    public static LabFeatures none() {
        return new LabFeatures(FeatureValue.unknown(), FeatureValue.unknown(),
            FeatureValue.unknown(), FeatureValue.unknown());
    }

    public FeatureValue<Double> get(LabCategory category) {
        return switch (category) {
            case CREATININE -> creatinine;
            case BILIRUBIN_TOTAL -> bilirubinTotal;
            case AST -> ast;
            case ALT -> alt;
        };
    }
}
