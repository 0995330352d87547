package com.donorid.service.aggregation;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static com.donorid.ClinicalFixtures.rangeFilter;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlausibleRangeFilterTest {

    private final PlausibleRangeFilter filter = rangeFilter();

    @Test
    void boundsAreInclusive() {
        assertThat(filter.isPlausible(PlausibleRangeFilter.VITALS, "height_cm", 76.0)).isTrue();
        assertThat(filter.isPlausible(PlausibleRangeFilter.VITALS, "height_cm", 75.9)).isFalse();
        assertThat(filter.isPlausible(PlausibleRangeFilter.ASSESSMENTS, "rass", -5.0)).isTrue();
        assertThat(filter.isPlausible(PlausibleRangeFilter.ASSESSMENTS, "gcs_total", 16.0)).isFalse();
    }

    @Test
    void missingOrNanValuesAreNeverPlausible() {
        assertThat(filter.isPlausible(PlausibleRangeFilter.LABS, "creatinine", null)).isFalse();
        assertThat(filter.isPlausible(PlausibleRangeFilter.LABS, "creatinine", Double.NaN)).isFalse();
    }

    @Test
    void unconfiguredCategoriesPass() {
        assertThat(filter.isPlausible(PlausibleRangeFilter.LABS, "lactate", 1000.0)).isTrue();
        assertThat(PlausibleRangeFilter.permissive().isPlausible(PlausibleRangeFilter.VITALS, "height_cm", 0.0))
            .isTrue();
    }

    @Test
    void labRangesAreOpenAbove() {
        assertThat(filter.isPlausible(PlausibleRangeFilter.LABS, "creatinine", 25.0)).isTrue();
        assertThat(filter.isPlausible(PlausibleRangeFilter.LABS, "bilirubin_total", 150.0)).isTrue();
        assertThat(filter.isPlausible(PlausibleRangeFilter.LABS, "ast", 45000.0)).isTrue();
        assertThat(filter.isPlausible(PlausibleRangeFilter.LABS, "alt", -1.0)).isFalse();
    }

    @Test
    void rangeWithoutMaxIsOpenAbove() throws IOException {
        String json = "{\"labs\":{\"creatinine\":{\"min\":0}}}";

        PlausibleRangeFilter openAbove = PlausibleRangeFilter.read(
            new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), new ObjectMapper());

        assertThat(openAbove.isPlausible(PlausibleRangeFilter.LABS, "creatinine", 1.0e6)).isTrue();
        assertThat(openAbove.isPlausible(PlausibleRangeFilter.LABS, "creatinine", -0.1)).isFalse();
    }

    @Test
    void rangeWithoutMinFailsTheLoad() {
        String json = "{\"labs\":{\"creatinine\":{\"max\":20}}}";

        assertThatThrownBy(() -> PlausibleRangeFilter.read(
            new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), new ObjectMapper()))
            .isInstanceOf(IOException.class);
    }
}
