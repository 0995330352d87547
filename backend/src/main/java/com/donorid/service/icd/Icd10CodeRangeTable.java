package com.donorid.service.icd;

import com.donorid.model.enums.DiagnosisCategory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Immutable ICD-10-CM range table. Built once at startup from a versioned JSON resource:
 * <pre>
 * { "version": "...", "categories": { "ischemic_heart": [ {"from": "I20", "to": "I25"} ] } }
 * </pre>
 */
public class Icd10CodeRangeTable implements DiagnosisClassifier {

    private final String version;
    private final Map<DiagnosisCategory, List<CodeRange>> ranges;

    public Icd10CodeRangeTable(String version, Map<DiagnosisCategory, List<CodeRange>> ranges) {
        this.version = version;
        Map<DiagnosisCategory, List<CodeRange>> copy = new EnumMap<>(DiagnosisCategory.class);
        ranges.forEach((category, list) -> copy.put(category, List.copyOf(list)));
        this.ranges = Collections.unmodifiableMap(copy);
    }

    /**
     * Reads a table from JSON. Unknown category names fail the load.
     */
    public static Icd10CodeRangeTable read(InputStream json, ObjectMapper objectMapper) throws IOException {
        JsonNode root = objectMapper.readTree(json);
        if (root == null || !root.hasNonNull("categories")) {
            throw new IOException("ICD-10 range table has no 'categories' object");
        }
        String version = root.path("version").asText("unversioned");
        Map<DiagnosisCategory, List<CodeRange>> ranges = new EnumMap<>(DiagnosisCategory.class);
        Iterator<Map.Entry<String, JsonNode>> fields = root.get("categories").fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            DiagnosisCategory category;
            try {
                category = DiagnosisCategory.fromValue(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new IOException("Unknown diagnosis category in range table: " + entry.getKey(), e);
            }
            List<CodeRange> list = new ArrayList<>();
            for (JsonNode range : entry.getValue()) {
                String from = range.path("from").asText();
                String to = range.path("to").asText(from);
                list.add(new CodeRange(from, to));
            }
            ranges.put(category, list);
        }
        return new Icd10CodeRangeTable(version, ranges);
    }

    @Override
    public Set<DiagnosisCategory> classify(String code) {
        String normalized = Icd10CodeNormalizer.normalize(code);
        if (normalized.isEmpty()) {
            return Set.of();
        }
        EnumSet<DiagnosisCategory> matched = EnumSet.noneOf(DiagnosisCategory.class);
        ranges.forEach((category, list) -> {
            for (CodeRange range : list) {
                if (range.matches(normalized)) {
                    matched.add(category);
                    break;
                }
            }
        });
        return matched;
    }

    @Override
    public String getVersion() {
        return version;
    }
}
