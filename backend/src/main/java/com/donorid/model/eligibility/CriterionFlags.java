package com.donorid.model.eligibility;

import com.donorid.model.enums.CohortDefinition;
import com.donorid.model.enums.EligibilityStage;
import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every criterion evaluated for one hospitalization. Computed once, never mutated.
 */
@Builder
public record CriterionFlags(
    boolean expired,
    boolean deathTimeKnown,
    boolean ageEligible,
    boolean locationEligible,
    boolean causeEligible,
    boolean noDiagnosisContraindication,
    boolean noPositiveCulture,
    boolean kidneyEligible,
    boolean liverEligible,
    boolean bmiEligible,
    boolean organQualityEligible,
    boolean imvEligible
) {

    /**
     * CALC only checks diagnosis contraindications; CLIF also requires no positive blood culture.
     */
    public boolean noContraindication(CohortDefinition definition) {
        return switch (definition) {
            case CALC -> noDiagnosisContraindication;
            case CLIF -> noDiagnosisContraindication && noPositiveCulture;
        };
    }

    public boolean passes(EligibilityStage stage, CohortDefinition definition) {
        return switch (stage) {
            case EXPIRED -> expired;
            case DEATH_TIME_KNOWN -> deathTimeKnown;
            case LOCATION -> locationEligible;
            case AGE -> ageEligible;
            case CAUSE -> causeEligible;
            case IMV -> imvEligible;
            case NO_CONTRAINDICATION -> noContraindication(definition);
            case ORGAN_QUALITY -> organQualityEligible;
        };
    }

    /**
     * Flat name to value view for the annotated output table.
     */
    public Map<String, Boolean> asMap() {
        Map<String, Boolean> flags = new LinkedHashMap<>();
        flags.put("expired", expired);
        flags.put("death_time_known", deathTimeKnown);
        flags.put("age_eligible", ageEligible);
        flags.put("location_eligible", locationEligible);
        flags.put("cause_eligible", causeEligible);
        flags.put("no_diagnosis_contraindication", noDiagnosisContraindication);
        flags.put("no_positive_culture", noPositiveCulture);
        flags.put("kidney_eligible", kidneyEligible);
        flags.put("liver_eligible", liverEligible);
        flags.put("bmi_eligible", bmiEligible);
        flags.put("organ_quality_eligible", organQualityEligible);
        flags.put("imv_eligible", imvEligible);
        return flags;
    }
}
