package com.donorid.dataset;

import com.donorid.model.clinical.Hospitalization;

import java.util.List;

/**
 * One or more hospitalizations of a patient treated as a single stay.
 *
 * @param hospitalization the combined stay, keyed by the first member's id
 * @param memberIds       member hospitalization ids in admission order
 */
public record EncounterBlock(Hospitalization hospitalization, List<String> memberIds) {

    public EncounterBlock {
        memberIds = List.copyOf(memberIds);
    }

    public String getId() {
        return hospitalization.getHospitalizationId();
    }

    public boolean isStitched() {
        return memberIds.size() > 1;
    }
}
