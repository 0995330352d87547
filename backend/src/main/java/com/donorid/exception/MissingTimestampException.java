package com.donorid.exception;

/**
 * An expired hospitalization has neither a death time nor a discharge time.
 */
public class MissingTimestampException extends Exception {

    private final String hospitalizationId;

    public MissingTimestampException(String hospitalizationId) {
        super("No usable death time for hospitalization " + hospitalizationId);
        this.hospitalizationId = hospitalizationId;
    }

    public String getHospitalizationId() {
        return hospitalizationId;
    }
}
