package com.donorid.service;

import com.donorid.config.EligibilityThresholds;
import com.donorid.exception.MissingTimestampException;
import com.donorid.model.clinical.Hospitalization;
import com.donorid.model.clinical.Patient;
import com.donorid.model.window.ResolvedWindows;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static com.donorid.ClinicalFixtures.*;
import static org.assertj.core.api.Assertions.*;

class TemporalWindowResolverTest {

    private final TemporalWindowResolver resolver = new TemporalWindowResolver(EligibilityThresholds.DEFAULTS);

    @Test
    void usesPatientDeathTimeWhenPresent() throws MissingTimestampException {
        Hospitalization h = expired("h1", "p1");
        h.setDischargeDttm(DEATH.plusHours(6));
        Patient p = patient("p1", null, DEATH);

        assertThat(resolver.resolveDeathTime(h, p)).isEqualTo(DEATH);
    }

    @Test
    void capsDeathTimeAtDischarge() throws MissingTimestampException {
        Hospitalization h = expired("h1", "p1");
        Patient p = patient("p1", null, DEATH.plusDays(2));

        assertThat(resolver.resolveDeathTime(h, p)).isEqualTo(DEATH);
    }

    @Test
    void fallsBackToDischargeWhenDeathTimeMissing() throws MissingTimestampException {
        Hospitalization h = expired("h1", "p1");

        assertThat(resolver.resolveDeathTime(h, patient("p1", null, null))).isEqualTo(DEATH);
        assertThat(resolver.resolveDeathTime(h, null)).isEqualTo(DEATH);
    }

    @Test
    void throwsWhenNoTimestampAvailable() {
        Hospitalization h = expired("h1", "p1");
        h.setDischargeDttm(null);

        assertThatThrownBy(() -> resolver.resolveDeathTime(h, patient("p1", null, null)))
            .isInstanceOf(MissingTimestampException.class)
            .hasMessageContaining("h1");
    }

    @Test
    void lookbackWindowsEndAtDeath() throws MissingTimestampException {
        ResolvedWindows windows = resolver.resolve(expired("h1", "p1"), patient("p1", null, DEATH));

        assertThat(windows.deathTime()).isEqualTo(DEATH);
        assertThat(windows.imv().start()).isEqualTo(DEATH.minusHours(48));
        assertThat(windows.imv().end()).isEqualTo(DEATH);
        assertThat(windows.culture()).isEqualTo(windows.imv());
        assertThat(windows.imv().contains(DEATH.minusHours(48))).isTrue();
        assertThat(windows.imv().contains(DEATH.minusHours(49))).isFalse();
    }

    @Test
    void lifetimeWindowCoversTheStay() throws MissingTimestampException {
        ResolvedWindows windows = resolver.resolve(expired("h1", "p1"), patient("p1", null, DEATH));

        assertThat(windows.lifetime().start()).isEqualTo(ADMISSION);
        assertThat(windows.lifetime().end()).isEqualTo(DEATH);
    }

    @Test
    void lifetimeWindowIsOpenAtStartWithoutAdmission() throws MissingTimestampException {
        Hospitalization h = expired("h1", "p1");
        h.setAdmissionDttm(null);

        ResolvedWindows windows = resolver.resolve(h, patient("p1", null, DEATH));

        assertThat(windows.lifetime().start()).isEqualTo(LocalDateTime.MIN);
        assertThat(windows.lifetime().contains(ADMISSION.minusYears(1))).isTrue();
    }

    @Test
    void rejectsHospitalizationThatIsNotExpired() {
        assertThatThrownBy(() -> resolver.resolve(discharged("h1", "p1"), patient("p1", null, null)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
