package com.donorid.config;

import com.donorid.service.aggregation.PlausibleRangeFilter;
import com.donorid.service.icd.DiagnosisClassifier;
import com.donorid.service.icd.Icd10CodeRangeTable;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Loads the versioned reference tables once at startup. Both are read-only for the life of the process.
 */
@Configuration
@Slf4j
public class ReferenceDataConfig {

    @Value("${donor.reference.icd10-ranges:classpath:reference/icd10-code-ranges.json}")
    private Resource icd10Ranges;

    @Value("${donor.reference.outlier-ranges:classpath:reference/outlier-ranges.json}")
    private Resource outlierRanges;

    @Bean
    public DiagnosisClassifier diagnosisClassifier(ObjectMapper objectMapper) {
        try (InputStream in = icd10Ranges.getInputStream()) {
            Icd10CodeRangeTable table = Icd10CodeRangeTable.read(in, objectMapper);
            log.info("Loaded ICD-10 code range table version {} from {}", table.getVersion(), icd10Ranges);
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load ICD-10 code ranges from " + icd10Ranges, e);
        }
    }

    @Bean
    public PlausibleRangeFilter plausibleRangeFilter(ObjectMapper objectMapper) {
        try (InputStream in = outlierRanges.getInputStream()) {
            log.info("Loading outlier ranges from {}", outlierRanges);
            return PlausibleRangeFilter.read(in, objectMapper);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load outlier ranges from " + outlierRanges, e);
        }
    }
}
