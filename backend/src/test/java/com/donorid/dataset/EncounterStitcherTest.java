package com.donorid.dataset;

import com.donorid.model.clinical.Hospitalization;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.donorid.ClinicalFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EncounterStitcherTest {

    private final EncounterStitcher stitcher = new EncounterStitcher(Duration.ofHours(12));

    @Test
    void staysWithinTheWindowFormOneBlock() {
        List<EncounterBlock> blocks = stitcher.stitch(List.of(
            expired("h2", "p1"),
            transferredOut("h1", "p1", ADMISSION.minusDays(4), ADMISSION.minusHours(12))));

        assertThat(blocks).hasSize(1);
        EncounterBlock block = blocks.get(0);
        assertThat(block.getId()).isEqualTo("h1");
        assertThat(block.memberIds()).containsExactly("h1", "h2");
        assertThat(block.isStitched()).isTrue();

        Hospitalization combined = block.hospitalization();
        assertThat(combined.getAdmissionDttm()).isEqualTo(ADMISSION.minusDays(4));
        assertThat(combined.getDischargeDttm()).isEqualTo(DEATH);
        assertThat(combined.isExpired()).isTrue();
    }

    @Test
    void gapLongerThanTheWindowKeepsStaysApart() {
        List<EncounterBlock> blocks = stitcher.stitch(List.of(
            transferredOut("h1", "p1", ADMISSION.minusDays(4), ADMISSION.minusHours(13)),
            expired("h2", "p1")));

        assertThat(blocks).extracting(EncounterBlock::getId).containsExactly("h1", "h2");
        assertThat(blocks).noneMatch(EncounterBlock::isStitched);
    }

    @Test
    void overlappingStaysAreLinkedAndLatestDischargeCloses() {
        Hospitalization overlapping = transferredOut("h2", "p1", ADMISSION.plusDays(1), DEATH.minusDays(1));

        List<EncounterBlock> blocks = stitcher.stitch(List.of(expired("h1", "p1"), overlapping));

        assertThat(blocks).hasSize(1);
        assertThat(blocks.get(0).hospitalization().getDischargeDttm()).isEqualTo(DEATH);
        assertThat(blocks.get(0).hospitalization().isExpired()).isTrue();
    }

    @Test
    void differentPatientsAndUntimedStaysAreNeverLinked() {
        Hospitalization untimed = transferredOut("h3", "p1", null, null);

        List<EncounterBlock> blocks = stitcher.stitch(List.of(
            expired("h1", "p1"),
            expired("h2", "p2"),
            untimed));

        assertThat(blocks).extracting(EncounterBlock::getId).containsExactly("h1", "h2", "h3");
        assertThat(blocks.get(2).hospitalization()).isSameAs(untimed);
    }

    @Test
    void disabledStitcherKeepsEveryStay() {
        List<EncounterBlock> blocks = EncounterStitcher.disabled().stitch(List.of(
            expired("h2", "p1"),
            transferredOut("h1", "p1", ADMISSION.minusDays(1), ADMISSION)));

        assertThat(blocks).extracting(EncounterBlock::getId).containsExactly("h1", "h2");
    }

    @Test
    void negativeWindowIsRejected() {
        assertThatThrownBy(() -> new EncounterStitcher(Duration.ofHours(-1)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
