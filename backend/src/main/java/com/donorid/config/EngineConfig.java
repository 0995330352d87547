package com.donorid.config;

import com.donorid.model.enums.MissingDataPolicy;
import com.donorid.service.aggregation.*;
import com.donorid.service.icd.DiagnosisClassifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Eligibility thresholds, missing-data policy and the per-table aggregators.
 */
@Configuration
public class EngineConfig {

    @Value("${donor.thresholds.max-age-years:75}")
    private double maxAgeYears;

    @Value("${donor.thresholds.max-creatinine:4}")
    private double maxCreatinine;

    @Value("${donor.thresholds.max-bilirubin-total:4}")
    private double maxBilirubinTotal;

    @Value("${donor.thresholds.max-ast:700}")
    private double maxAst;

    @Value("${donor.thresholds.max-alt:700}")
    private double maxAlt;

    @Value("${donor.thresholds.max-bmi:50}")
    private double maxBmi;

    @Value("${donor.thresholds.lookback-hours:48}")
    private long lookbackHours;

    @Value("${donor.missing-data-policy:fail}")
    private String missingDataPolicy;

    @Bean
    public EligibilityThresholds eligibilityThresholds() {
        return new EligibilityThresholds(maxAgeYears, maxCreatinine, maxBilirubinTotal, maxAst, maxAlt, maxBmi,
            Duration.ofHours(lookbackHours));
    }

    @Bean
    public MissingDataPolicy missingDataPolicy() {
        return MissingDataPolicy.fromValue(missingDataPolicy);
    }

    @Bean
    public LabAggregator labAggregator(PlausibleRangeFilter plausibleRangeFilter) {
        return new LabAggregator(plausibleRangeFilter);
    }

    @Bean
    public VitalsAggregator vitalsAggregator(PlausibleRangeFilter plausibleRangeFilter) {
        return new VitalsAggregator(plausibleRangeFilter);
    }

    @Bean
    public AssessmentAggregator assessmentAggregator(PlausibleRangeFilter plausibleRangeFilter) {
        return new AssessmentAggregator(plausibleRangeFilter);
    }

    @Bean
    public DiagnosisAggregator diagnosisAggregator(DiagnosisClassifier diagnosisClassifier) {
        return new DiagnosisAggregator(diagnosisClassifier);
    }

    @Bean
    public RespiratorySupportAggregator respiratorySupportAggregator() {
        return new RespiratorySupportAggregator();
    }

    @Bean
    public MicrobiologyAggregator microbiologyAggregator() {
        return new MicrobiologyAggregator();
    }

    @Bean
    public CrrtAggregator crrtAggregator() {
        return new CrrtAggregator();
    }

    @Bean
    public AdtAggregator adtAggregator() {
        return new AdtAggregator();
    }
}
