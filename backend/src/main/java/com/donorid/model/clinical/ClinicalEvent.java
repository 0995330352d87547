package com.donorid.model.clinical;

import java.time.LocalDateTime;

/**
 * A timestamped row of an event table, keyed to one hospitalization.
 */
public interface ClinicalEvent {

    String getHospitalizationId();

    LocalDateTime getEventTime();
}
