package com.donorid.service.aggregation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Outlier screen for numeric event values. Values outside the configured range are treated as not recorded.
 * Categories without a configured range always pass.
 */
public class PlausibleRangeFilter {

    public static final String LABS = "labs";
    public static final String VITALS = "vitals";
    public static final String ASSESSMENTS = "patient_assessments";

    private final Map<String, Map<String, PlausibleRange>> rangesByTable;

    public PlausibleRangeFilter(Map<String, Map<String, PlausibleRange>> rangesByTable) {
        Map<String, Map<String, PlausibleRange>> copy = new HashMap<>();
        rangesByTable.forEach((table, ranges) -> {
            Map<String, PlausibleRange> lowered = new HashMap<>();
            ranges.forEach((category, range) -> lowered.put(category.toLowerCase(Locale.ROOT), range));
            copy.put(table, Collections.unmodifiableMap(lowered));
        });
        this.rangesByTable = Collections.unmodifiableMap(copy);
    }

    /**
     * Filter that accepts every value.
     */
    public static PlausibleRangeFilter permissive() {
        return new PlausibleRangeFilter(Map.of());
    }

    /**
     * Reads ranges from JSON shaped as {"labs": {"creatinine": {"min": 0}}, "vitals": {"height_cm": {"min": 76, "max": 255}}}.
     * A range without "max" is open above.
     */
    public static PlausibleRangeFilter read(InputStream json, ObjectMapper objectMapper) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("Outlier range file is not a JSON object");
        }
        Map<String, Map<String, PlausibleRange>> ranges = new HashMap<>();
        for (String table : List.of(LABS, VITALS, ASSESSMENTS)) {
            JsonNode tableNode = root.path(table);
            if (!tableNode.isObject()) {
                continue;
            }
            Map<String, PlausibleRange> tableRanges = new HashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = tableNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                JsonNode range = entry.getValue();
                if (!range.has("min")) {
                    throw new IOException("Range for " + table + "." + entry.getKey() + " needs min");
                }
                double max = range.has("max") ? range.get("max").asDouble() : Double.POSITIVE_INFINITY;
                tableRanges.put(entry.getKey(), new PlausibleRange(range.get("min").asDouble(), max));
            }
            ranges.put(table, tableRanges);
        }
        return new PlausibleRangeFilter(ranges);
    }

    /**
     * @return false for null values and for values outside the category's range
     */
    public boolean isPlausible(String table, String category, Double value) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return false;
        }
        if (category == null) {
            return true;
        }
        PlausibleRange range = rangesByTable.getOrDefault(table, Map.of()).get(category.toLowerCase(Locale.ROOT));
        return range == null || range.contains(value);
    }
}
