package com.donorid.dataset;

import com.donorid.model.clinical.Hospitalization;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Links a patient's back-to-back hospitalizations into encounter blocks.
 * <p>
 * Stays are taken in admission order. A stay joins the current block when it is admitted no later than
 * {@code window} after the block's latest discharge; overlapping stays always join. A stay without an admission
 * time never joins, and a block whose members all lack a discharge time accepts nothing further.
 * <p>
 * The combined stay keeps the first member's id, admission and admission type, and takes the discharge time and
 * category of the member discharged last.
 */
public final class EncounterStitcher {

    private static final Comparator<Hospitalization> BY_ADMISSION = Comparator
        .comparing(Hospitalization::getAdmissionDttm, Comparator.nullsLast(Comparator.naturalOrder()))
        .thenComparing(Hospitalization::getHospitalizationId);

    private final Duration window;

    /**
     * @param window maximum gap between discharge and the next admission; null disables stitching
     */
    public EncounterStitcher(Duration window) {
        if (window != null && window.isNegative()) {
            throw new IllegalArgumentException("Stitching window must not be negative: " + window);
        }
        this.window = window;
    }

    public static EncounterStitcher disabled() {
        return new EncounterStitcher(null);
    }

    public boolean isEnabled() {
        return window != null;
    }

    /**
     * @param hospitalizations stays with both keys present
     * @return blocks ordered by id
     */
    public List<EncounterBlock> stitch(List<Hospitalization> hospitalizations) {
        if (window == null) {
            return hospitalizations.stream()
                .map(h -> new EncounterBlock(h, List.of(h.getHospitalizationId())))
                .sorted(Comparator.comparing(EncounterBlock::getId))
                .toList();
        }
        Map<String, List<Hospitalization>> byPatient = hospitalizations.stream()
            .collect(Collectors.groupingBy(Hospitalization::getPatientId, TreeMap::new, Collectors.toList()));

        List<EncounterBlock> blocks = new ArrayList<>();
        for (List<Hospitalization> stays : byPatient.values()) {
            stays.sort(BY_ADMISSION);
            List<Hospitalization> current = new ArrayList<>();
            LocalDateTime currentEnd = null;
            for (Hospitalization stay : stays) {
                if (!current.isEmpty() && links(currentEnd, stay)) {
                    current.add(stay);
                } else {
                    if (!current.isEmpty()) {
                        blocks.add(combine(current));
                    }
                    current = new ArrayList<>(List.of(stay));
                    currentEnd = null;
                }
                if (stay.getDischargeDttm() != null
                        && (currentEnd == null || stay.getDischargeDttm().isAfter(currentEnd))) {
                    currentEnd = stay.getDischargeDttm();
                }
            }
            if (!current.isEmpty()) {
                blocks.add(combine(current));
            }
        }
        blocks.sort(Comparator.comparing(EncounterBlock::getId));
        return blocks;
    }

    private boolean links(LocalDateTime blockEnd, Hospitalization next) {
        return blockEnd != null
            && next.getAdmissionDttm() != null
            && !next.getAdmissionDttm().isAfter(blockEnd.plus(window));
    }

    private static EncounterBlock combine(List<Hospitalization> members) {
        List<String> ids = members.stream().map(Hospitalization::getHospitalizationId).toList();
        Hospitalization first = members.get(0);
        if (members.size() == 1) {
            return new EncounterBlock(first, ids);
        }
        Hospitalization closing = first;
        for (Hospitalization member : members) {
            if (member.getDischargeDttm() != null
                    && (closing.getDischargeDttm() == null || !member.getDischargeDttm().isBefore(closing.getDischargeDttm()))) {
                closing = member;
            }
        }
        Hospitalization combined = Hospitalization.builder()
            .hospitalizationId(first.getHospitalizationId())
            .patientId(first.getPatientId())
            .admissionDttm(first.getAdmissionDttm())
            .admissionTypeCategory(first.getAdmissionTypeCategory())
            .ageAtAdmission(first.getAgeAtAdmission())
            .dischargeDttm(closing.getDischargeDttm())
            .dischargeCategory(closing.getDischargeCategory())
            .build();
        return new EncounterBlock(combined, ids);
    }
}
