package com.donorid.service;

import com.donorid.config.EligibilityThresholds;
import com.donorid.model.eligibility.CriterionFlags;
import com.donorid.model.enums.LocationCategory;
import com.donorid.model.enums.MissingDataPolicy;
import com.donorid.model.feature.FeatureRecord;
import com.donorid.model.feature.FeatureValue;
import com.donorid.model.feature.LabFeatures;
import org.springframework.stereotype.Service;

/**
 * Maps a feature record to its criterion flags.
 * Pure and total: every unknown input resolves through the configured {@link MissingDataPolicy}.
 */
@Service
public class CriterionEvaluatorService {

    private final EligibilityThresholds thresholds;
    private final MissingDataPolicy missingDataPolicy;

    public CriterionEvaluatorService(EligibilityThresholds thresholds, MissingDataPolicy missingDataPolicy) {
        this.thresholds = thresholds;
        this.missingDataPolicy = missingDataPolicy;
    }

    public CriterionFlags evaluate(FeatureRecord features) {
        boolean kidney = isKidneyEligible(features.labs().creatinine(), features.crrtDuringStay());
        boolean liver = isLiverEligible(features.labs());
        boolean bmi = isBmiEligible(features.vitals().bmi());
        return CriterionFlags.builder()
            .expired(features.expired())
            .deathTimeKnown(features.deathTime().isKnown())
            .ageEligible(isAgeEligible(features.ageYears()))
            .locationEligible(isLocationEligible(features.location().locationAtDeath()))
            .causeEligible(features.diagnoses().hasQualifyingCause())
            .noDiagnosisContraindication(!features.diagnoses().hasContraindication())
            .noPositiveCulture(!features.positiveBloodCulture())
            .kidneyEligible(kidney)
            .liverEligible(liver)
            .bmiEligible(bmi)
            .organQualityEligible((kidney || liver) && bmi)
            .imvEligible(features.imvWithinLookback())
            .build();
    }

    public boolean isAgeEligible(FeatureValue<Double> ageYears) {
        return ageYears.test(age -> age <= thresholds.maxAgeYears(), unknownOutcome());
    }

    public boolean isLocationEligible(FeatureValue<LocationCategory> locationAtDeath) {
        return locationAtDeath.test(LocationCategory::isInpatientDeathLocation, unknownOutcome());
    }

    /**
     * Creatinine below threshold and no CRRT at any time in the stay.
     */
    public boolean isKidneyEligible(FeatureValue<Double> creatinine, boolean crrtDuringStay) {
        return !crrtDuringStay && creatinine.test(c -> c < thresholds.maxCreatinine(), unknownOutcome());
    }

    /**
     * Bilirubin, AST and ALT must each be known and below threshold.
     */
    public boolean isLiverEligible(LabFeatures labs) {
        return labs.bilirubinTotal().test(v -> v < thresholds.maxBilirubinTotal(), unknownOutcome())
            && labs.ast().test(v -> v < thresholds.maxAst(), unknownOutcome())
            && labs.alt().test(v -> v < thresholds.maxAlt(), unknownOutcome());
    }

    public boolean isBmiEligible(FeatureValue<Double> bmi) {
        return bmi.test(b -> b <= thresholds.maxBmi(), unknownOutcome());
    }

    private boolean unknownOutcome() {
        return missingDataPolicy.outcomeWhenUnknown();
    }
}
