package com.donorid.dataset;

import com.donorid.exception.SourceTableException;
import com.donorid.model.clinical.ClinicalEvent;

import java.util.*;
import java.util.function.UnaryOperator;

/**
 * Event table held in memory and indexed by hospitalization.
 * Each hospitalization's rows are sorted by event time once, so reductions never depend on input order.
 */
public class InMemoryEventTable<E extends ClinicalEvent> implements EventTable<E> {

    private static final Comparator<ClinicalEvent> BY_EVENT_TIME =
        Comparator.comparing(ClinicalEvent::getEventTime, Comparator.nullsLast(Comparator.naturalOrder()));

    private final Map<String, List<E>> rowsByHospitalization;
    private final int size;
    private final int rowsWithoutKey;

    /**
     * @throws SourceTableException if the table is null or no row carries a hospitalization id
     */
    public InMemoryEventTable(String name, Collection<E> rows) {
        this(name, rows, UnaryOperator.identity());
    }

    /**
     * Indexes each row under {@code keyMapper} applied to its hospitalization id, so rows of stitched stays are
     * found under the encounter block's id.
     *
     * @throws SourceTableException if the table is null or no row carries a hospitalization id
     */
    public InMemoryEventTable(String name, Collection<E> rows, UnaryOperator<String> keyMapper) {
        if (rows == null) {
            throw new SourceTableException(name, "table is missing");
        }
        Map<String, List<E>> index = new HashMap<>();
        int missingKey = 0;
        for (E row : rows) {
            if (row.getHospitalizationId() == null) {
                missingKey++;
                continue;
            }
            index.computeIfAbsent(keyMapper.apply(row.getHospitalizationId()), k -> new ArrayList<>()).add(row);
        }
        if (!rows.isEmpty() && missingKey == rows.size()) {
            throw new SourceTableException(name, "required column hospitalization_id is empty");
        }
        index.replaceAll((id, list) -> {
            list.sort(BY_EVENT_TIME);
            return Collections.unmodifiableList(list);
        });
        this.rowsByHospitalization = index;
        this.size = rows.size() - missingKey;
        this.rowsWithoutKey = missingKey;
    }

    @Override
    public List<E> findByHospitalization(String hospitalizationId) {
        return rowsByHospitalization.getOrDefault(hospitalizationId, List.of());
    }

    @Override
    public boolean containsHospitalization(String hospitalizationId) {
        return rowsByHospitalization.containsKey(hospitalizationId);
    }

    @Override
    public int size() {
        return size;
    }

    /**
     * Rows dropped at load because they had no hospitalization id.
     */
    public int getRowsWithoutKey() {
        return rowsWithoutKey;
    }
}
