package com.donorid.config;

import java.time.Duration;

/**
 * Numeric cut-offs shared by both cohort definitions.
 *
 * @param maxAgeYears       oldest eligible age, inclusive
 * @param maxCreatinine     creatinine must be strictly below (mg/dL)
 * @param maxBilirubinTotal total bilirubin must be strictly below (mg/dL)
 * @param maxAst            AST must be strictly below (U/L)
 * @param maxAlt            ALT must be strictly below (U/L)
 * @param maxBmi            highest eligible BMI, inclusive
 * @param lookback          length of the IMV and culture windows ending at death
 */
public record EligibilityThresholds(
    double maxAgeYears,
    double maxCreatinine,
    double maxBilirubinTotal,
    double maxAst,
    double maxAlt,
    double maxBmi,
    Duration lookback
) {

    public static final EligibilityThresholds DEFAULTS =
        new EligibilityThresholds(75, 4, 4, 700, 700, 50, Duration.ofHours(48));
}
