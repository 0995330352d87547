package com.donorid.service;

import com.donorid.config.EligibilityThresholds;
import com.donorid.exception.MissingTimestampException;
import com.donorid.model.clinical.Hospitalization;
import com.donorid.model.clinical.Patient;
import com.donorid.model.window.ResolvedWindows;
import com.donorid.model.window.TimeWindow;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Resolves the canonical death time of an expired hospitalization and the windows anchored on it.
 * <ul>
 *   <li>death time: patient death_dttm, capped at discharge_dttm; discharge_dttm when death_dttm is absent</li>
 *   <li>IMV and culture windows: [death - lookback, death]</li>
 *   <li>lifetime window: [admission, discharge]; diagnoses and organ quality labs use the full stay</li>
 * </ul>
 */
@Component
public class TemporalWindowResolver {

    private final EligibilityThresholds thresholds;

    public TemporalWindowResolver(EligibilityThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * @param patient may be null when the patient row is missing
     * @throws MissingTimestampException when neither death nor discharge time is recorded
     */
    public LocalDateTime resolveDeathTime(Hospitalization hospitalization, Patient patient)
            throws MissingTimestampException {
        LocalDateTime death = patient != null ? patient.getDeathDttm() : null;
        LocalDateTime discharge = hospitalization.getDischargeDttm();
        if (death != null && discharge != null && death.isAfter(discharge)) {
            return discharge;
        }
        if (death != null) {
            return death;
        }
        if (discharge != null) {
            return discharge;
        }
        throw new MissingTimestampException(hospitalization.getHospitalizationId());
    }

    /**
     * @throws IllegalArgumentException  if the hospitalization is not expired
     * @throws MissingTimestampException when no death time can be resolved
     */
    public ResolvedWindows resolve(Hospitalization hospitalization, Patient patient)
            throws MissingTimestampException {
        if (!hospitalization.isExpired()) {
            throw new IllegalArgumentException("Hospitalization " + hospitalization.getHospitalizationId()
                + " is not expired");
        }
        LocalDateTime death = resolveDeathTime(hospitalization, patient);
        TimeWindow lookback = TimeWindow.lookback(death, thresholds.lookback());
        return new ResolvedWindows(death, lookback, lookback, lifetime(hospitalization, death));
    }

    private static TimeWindow lifetime(Hospitalization hospitalization, LocalDateTime death) {
        LocalDateTime end = hospitalization.getDischargeDttm() != null ? hospitalization.getDischargeDttm() : death;
        if (end.isBefore(death)) {
            end = death;
        }
        LocalDateTime admission = hospitalization.getAdmissionDttm();
        // Open start when admission is missing or recorded after death
        LocalDateTime start = admission != null && !admission.isAfter(death) ? admission : LocalDateTime.MIN;
        return new TimeWindow(start, end);
    }
}
