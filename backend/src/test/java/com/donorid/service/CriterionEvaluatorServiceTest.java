package com.donorid.service;

import com.donorid.config.EligibilityThresholds;
import com.donorid.model.eligibility.CriterionFlags;
import com.donorid.model.enums.DiagnosisCategory;
import com.donorid.model.enums.LocationCategory;
import com.donorid.model.enums.MissingDataPolicy;
import com.donorid.model.feature.*;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Set;

import static com.donorid.ClinicalFixtures.DEATH;
import static org.assertj.core.api.Assertions.assertThat;

class CriterionEvaluatorServiceTest {

    private final CriterionEvaluatorService evaluator =
        new CriterionEvaluatorService(EligibilityThresholds.DEFAULTS, MissingDataPolicy.FAIL);

    @Test
    void bmiBoundaryIsInclusive() {
        assertThat(evaluator.isBmiEligible(FeatureValue.known(50.000))).isTrue();
        assertThat(evaluator.isBmiEligible(FeatureValue.known(50.001))).isFalse();
        assertThat(evaluator.isBmiEligible(FeatureValue.unknown())).isFalse();
    }

    @Test
    void ageEligibilityIsMonotonic() {
        boolean previous = true;
        for (double age = 0; age <= 120; age += 0.25) {
            boolean eligible = evaluator.isAgeEligible(FeatureValue.known(age));
            assertThat(!previous && eligible).as("age %s flipped back to eligible", age).isFalse();
            previous = eligible;
        }
        assertThat(evaluator.isAgeEligible(FeatureValue.known(75.0))).isTrue();
        assertThat(evaluator.isAgeEligible(FeatureValue.known(75.01))).isFalse();
        assertThat(evaluator.isAgeEligible(FeatureValue.unknown())).isFalse();
    }

    @ParameterizedTest
    @CsvSource({
        ",    100, 100",
        "1.0,    , 100",
        "1.0, 100,    "
    })
    void liverFailsWhenAnyLabIsUnknown(Double bilirubin, Double ast, Double alt) {
        LabFeatures labs = new LabFeatures(FeatureValue.unknown(), FeatureValue.ofNullable(bilirubin),
            FeatureValue.ofNullable(ast), FeatureValue.ofNullable(alt));

        assertThat(evaluator.isLiverEligible(labs)).isFalse();
    }

    @Test
    void liverRequiresAllThreeBelowThreshold() {
        assertThat(evaluator.isLiverEligible(labs(null, 3.9, 699.0, 699.0))).isTrue();
        assertThat(evaluator.isLiverEligible(labs(null, 4.0, 100.0, 100.0))).isFalse();
        assertThat(evaluator.isLiverEligible(labs(null, 1.0, 700.0, 100.0))).isFalse();
        assertThat(evaluator.isLiverEligible(labs(null, 1.0, 100.0, 700.0))).isFalse();
    }

    @Test
    void kidneyFailsOnCrrtRegardlessOfCreatinine() {
        assertThat(evaluator.isKidneyEligible(FeatureValue.known(2.0), false)).isTrue();
        assertThat(evaluator.isKidneyEligible(FeatureValue.known(2.0), true)).isFalse();
        assertThat(evaluator.isKidneyEligible(FeatureValue.known(4.0), false)).isFalse();
        assertThat(evaluator.isKidneyEligible(FeatureValue.unknown(), false)).isFalse();
    }

    @Test
    void passPolicyTreatsUnknownAsEligible() {
        CriterionEvaluatorService lenient =
            new CriterionEvaluatorService(EligibilityThresholds.DEFAULTS, MissingDataPolicy.PASS);

        assertThat(lenient.isBmiEligible(FeatureValue.unknown())).isTrue();
        assertThat(lenient.isKidneyEligible(FeatureValue.unknown(), true)).isFalse();
    }

    @Test
    void locationEligibilityUsesInpatientLocations() {
        assertThat(evaluator.isLocationEligible(FeatureValue.known(LocationCategory.ICU))).isTrue();
        assertThat(evaluator.isLocationEligible(FeatureValue.known(LocationCategory.ED))).isTrue();
        assertThat(evaluator.isLocationEligible(FeatureValue.known(LocationCategory.HOSPICE))).isFalse();
        assertThat(evaluator.isLocationEligible(FeatureValue.unknown())).isFalse();
    }

    @Test
    void crrtWithMissingLiverLabsFailsOrganQuality() {
        FeatureRecord features = baseRecord()
            .labs(labs(2.0, null, null, null))
            .crrtDuringStay(true)
            .vitals(bmi(28.0))
            .build();

        CriterionFlags flags = evaluator.evaluate(features);

        assertThat(flags.kidneyEligible()).isFalse();
        assertThat(flags.liverEligible()).isFalse();
        assertThat(flags.organQualityEligible()).isFalse();
    }

    @Test
    void organQualityNeedsBmiAndOneOrgan() {
        CriterionFlags kidneyOnly = evaluator.evaluate(baseRecord()
            .labs(labs(3.5, null, null, null)).vitals(bmi(28.0)).build());
        CriterionFlags highBmi = evaluator.evaluate(baseRecord()
            .labs(labs(3.5, 1.0, 50.0, 50.0)).vitals(bmi(55.0)).build());

        assertThat(kidneyOnly.organQualityEligible()).isTrue();
        assertThat(highBmi.kidneyEligible()).isTrue();
        assertThat(highBmi.liverEligible()).isTrue();
        assertThat(highBmi.organQualityEligible()).isFalse();
    }

    @Test
    void contraindicationsComeFromDiagnosesAndCultures() {
        CriterionFlags flags = evaluator.evaluate(baseRecord()
            .diagnoses(new DiagnosisFeatures(Set.of(DiagnosisCategory.SEPSIS, DiagnosisCategory.CEREBROVASCULAR), 0))
            .positiveBloodCulture(true)
            .build());

        assertThat(flags.causeEligible()).isTrue();
        assertThat(flags.noDiagnosisContraindication()).isFalse();
        assertThat(flags.noPositiveCulture()).isFalse();
    }

    private static FeatureRecord.FeatureRecordBuilder baseRecord() {
        return FeatureRecord.builder()
            .hospitalizationId("h1")
            .patientId("p1")
            .expired(true)
            .deathTime(FeatureValue.known(DEATH))
            .ageYears(FeatureValue.known(60.0))
            .labs(LabFeatures.none())
            .vitals(VitalFeatures.none())
            .diagnoses(DiagnosisFeatures.none())
            .assessments(AssessmentFeatures.none())
            .location(LocationFeatures.none());
    }

    private static LabFeatures labs(Double creatinine, Double bilirubin, Double ast, Double alt) {
        return new LabFeatures(FeatureValue.ofNullable(creatinine), FeatureValue.ofNullable(bilirubin),
            FeatureValue.ofNullable(ast), FeatureValue.ofNullable(alt));
    }

    private static VitalFeatures bmi(double value) {
        return new VitalFeatures(FeatureValue.unknown(), FeatureValue.unknown(), FeatureValue.known(value),
            FeatureValue.unknown(), FeatureValue.unknown());
    }
}
