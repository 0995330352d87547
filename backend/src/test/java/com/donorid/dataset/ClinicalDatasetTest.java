package com.donorid.dataset;

import com.donorid.exception.SourceTableException;
import com.donorid.model.clinical.Hospitalization;
import com.donorid.model.clinical.LabResult;
import com.donorid.model.enums.RepeatDecedentPolicy;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.donorid.ClinicalFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClinicalDatasetTest {

    @Test
    void missingTableAbortsTheLoad() {
        assertThatThrownBy(() -> ClinicalDataset.builder()
                .patients(List.of())
                .hospitalizations(List.of())
                .adt(List.of())
                .labs(null)
                .vitals(List.of())
                .respiratorySupport(List.of())
                .microbiology(List.of())
                .crrt(List.of())
                .assessments(List.of())
                .diagnoses(List.of())
                .build())
            .isInstanceOf(SourceTableException.class)
            .hasMessageContaining("labs");
    }

    @Test
    void emptyKeyColumnAbortsTheLoad() {
        assertThatThrownBy(() -> dataset()
                .patient(patientAged("p1", 50))
                .hospitalization(expired("h1", "p1"))
                .vital(vital(null, DEATH, "weight_kg", 80.0))
                .build())
            .isInstanceOf(SourceTableException.class)
            .satisfies(e -> assertThat(((SourceTableException) e).getTable()).isEqualTo("vitals"));
    }

    @Test
    void rowsWithoutKeyAreSkippedAndCounted() {
        ClinicalDataset dataset = dataset()
            .patient(patientAged("p1", 50))
            .hospitalization(expired("h1", "p1"))
            .hospitalization(expired(null, "p1"))
            .lab(lab("h1", DEATH, "creatinine", 1.0))
            .lab(lab(null, DEATH, "creatinine", 2.0))
            .build();

        assertThat(dataset.getHospitalizations()).hasSize(1);
        assertThat(dataset.getLabs().size()).isEqualTo(1);
        assertThat(dataset.getRowsWithoutKey()).isEqualTo(2);
    }

    @Test
    void stitchedRowsAreFoundUnderTheBlockId() {
        ClinicalDataset dataset = dataset()
            .patient(patientAged("p1", 50))
            .hospitalization(transferredOut("h1", "p1", ADMISSION.minusDays(2), ADMISSION.minusHours(2)))
            .hospitalization(expired("h2", "p1"))
            .lab(lab("h1", ADMISSION.minusDays(1), "creatinine", 1.0))
            .lab(lab("h2", DEATH.minusDays(1), "creatinine", 2.0))
            .diagnosis(diagnosis("h2", "I63.9"))
            .stitchWithin(Duration.ofHours(12))
            .build();

        assertThat(dataset.getHospitalizations()).extracting(Hospitalization::getHospitalizationId)
            .containsExactly("h1");
        assertThat(dataset.findMemberIds("h1")).containsExactly("h1", "h2");
        assertThat(dataset.getStitchedBlockCount()).isEqualTo(1);
        assertThat(dataset.getLabs().findByHospitalization("h1")).extracting(LabResult::getLabValueNumeric)
            .containsExactly(1.0, 2.0);
        assertThat(dataset.getLabs().containsHospitalization("h2")).isFalse();
        assertThat(dataset.findDiagnoses("h1")).hasSize(1);
    }

    @Test
    void keepLastLeavesOutEarlierDeathsOfTheSamePatient() {
        Hospitalization earlier = expired("h1", "p1");
        earlier.setAdmissionDttm(ADMISSION.minusYears(1));
        earlier.setDischargeDttm(DEATH.minusYears(1));

        ClinicalDataset dataset = dataset()
            .patient(patientAged("p1", 50))
            .hospitalization(earlier)
            .hospitalization(expired("h2", "p1"))
            .hospitalization(discharged("h0", "p1"))
            .repeatDecedents(RepeatDecedentPolicy.KEEP_LAST)
            .build();

        assertThat(dataset.getHospitalizations()).extracting(Hospitalization::getHospitalizationId)
            .containsExactly("h0", "h2");
        assertThat(dataset.getRepeatDecedentsLeftOut()).isEqualTo(1);
    }

    @Test
    void eventsAreSortedByTimeWithUntimedRowsLast() {
        List<LabResult> rows = new ArrayList<>(List.of(
            lab("h1", null, "ast", 1.0),
            lab("h1", DEATH, "ast", 2.0),
            lab("h1", ADMISSION, "ast", 3.0)));
        InMemoryEventTable<LabResult> table = new InMemoryEventTable<>("labs", rows);

        assertThat(table.findByHospitalization("h1")).extracting(LabResult::getLabValueNumeric)
            .containsExactly(3.0, 2.0, 1.0);
        assertThat(table.findByHospitalization("missing")).isEmpty();
        assertThat(table.containsHospitalization("h1")).isTrue();
    }
}
