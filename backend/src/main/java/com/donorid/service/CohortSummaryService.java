package com.donorid.service;

import com.donorid.model.eligibility.AnnotatedHospitalization;
import com.donorid.model.enums.CohortDefinition;
import com.donorid.model.enums.LocationCategory;
import com.donorid.model.feature.FeatureRecord;
import com.donorid.model.feature.FeatureValue;
import com.donorid.model.summary.SummaryRow;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Descriptive statistics (Table One data) for the Overall, CALC and CLIF groups.
 * Overall is every expired hospitalization with a known death time.
 */
@Service
public class CohortSummaryService {

    public static final String OVERALL = "Overall";
    public static final String CALC = "CALC";
    public static final String CLIF = "CLIF";
    public static final String UNKNOWN_CATEGORY = "Unknown";
    public static final String NOT_AVAILABLE = "NA";

    private static final Map<String, Function<FeatureRecord, String>> CATEGORICAL = new LinkedHashMap<>();
    private static final Map<String, Function<FeatureRecord, FeatureValue<Double>>> NUMERIC = new LinkedHashMap<>();

    static {
        CATEGORICAL.put("race_category", FeatureRecord::raceCategory);
        CATEGORICAL.put("ethnicity_category", FeatureRecord::ethnicityCategory);
        CATEGORICAL.put("sex_category", FeatureRecord::sexCategory);
        CATEGORICAL.put("first_admission_location",
            f -> f.location().firstAdmissionLocation().map(LocationCategory::getValue).orElse(null));

        NUMERIC.put("age_at_death", FeatureRecord::ageYears);
        NUMERIC.put("hospital_los_days", f -> f.location().hospitalLengthOfStayDays());
        NUMERIC.put("first_icu_los_days", f -> f.location().firstIcuLengthOfStayDays());
        NUMERIC.put("bmi", f -> f.vitals().bmi());
        NUMERIC.put("creatinine", f -> f.labs().creatinine());
        NUMERIC.put("bilirubin_total", f -> f.labs().bilirubinTotal());
        NUMERIC.put("ast", f -> f.labs().ast());
        NUMERIC.put("alt", f -> f.labs().alt());
        NUMERIC.put("rass", f -> f.assessments().rass());
        NUMERIC.put("gcs_total", f -> f.assessments().gcsTotal());
    }

    public List<SummaryRow> summarize(List<AnnotatedHospitalization> hospitalizations) {
        Map<String, List<FeatureRecord>> groups = new LinkedHashMap<>();
        groups.put(OVERALL, select(hospitalizations, h -> h.flags().expired() && h.flags().deathTimeKnown()));
        groups.put(CALC, select(hospitalizations, h -> h.isIncluded(CohortDefinition.CALC)));
        groups.put(CLIF, select(hospitalizations, h -> h.isIncluded(CohortDefinition.CLIF)));

        List<SummaryRow> rows = new ArrayList<>();
        rows.add(row("n_patients", "", groups, g -> String.valueOf(
            g.stream().map(FeatureRecord::patientId).distinct().count())));
        rows.add(row("n_hospitalizations", "", groups, g -> String.valueOf(g.size())));
        rows.add(row("admission_years", "", groups, CohortSummaryService::admissionYearRange));

        CATEGORICAL.forEach((variable, getter) -> {
            SortedSet<String> categories = new TreeSet<>();
            groups.values().forEach(g -> g.forEach(f -> categories.add(categoryOf(getter.apply(f)))));
            for (String category : categories) {
                rows.add(row(variable, category, groups, g -> countWithPercent(g, f -> category.equals(
                    categoryOf(getter.apply(f))))));
            }
        });

        NUMERIC.forEach((variable, getter) -> {
            rows.add(row(variable, "median [IQR]", groups, g -> medianIqr(knownValues(g, getter))));
            rows.add(row(variable, "valid", groups, g -> String.valueOf(knownValues(g, getter).size())));
            rows.add(row(variable, "missing", groups, g -> String.valueOf(g.size() - knownValues(g, getter).size())));
        });
        return rows;
    }

    // ========================================================================
    // Statistics
    // ========================================================================

    /**
     * Quantile by linear interpolation between closest ranks. Input must be sorted and non-empty.
     */
    static double quantile(List<Double> sorted, double q) {
        double position = q * (sorted.size() - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        double fraction = position - lower;
        return sorted.get(lower) + (sorted.get(upper) - sorted.get(lower)) * fraction;
    }

    static String medianIqr(List<Double> values) {
        if (values.isEmpty()) {
            return NOT_AVAILABLE;
        }
        List<Double> sorted = new ArrayList<>(values);
        Collections.sort(sorted);
        return String.format(Locale.ROOT, "%.1f [%.1f, %.1f]",
            quantile(sorted, 0.5), quantile(sorted, 0.25), quantile(sorted, 0.75));
    }

    private static String countWithPercent(List<FeatureRecord> group, Predicate<FeatureRecord> predicate) {
        long count = group.stream().filter(predicate).count();
        double percent = group.isEmpty() ? 0.0 : 100.0 * count / group.size();
        return String.format(Locale.ROOT, "%d (%.1f%%)", count, percent);
    }

    private static String admissionYearRange(List<FeatureRecord> group) {
        IntSummaryStatistics years = group.stream()
            .filter(f -> f.admissionTime() != null)
            .mapToInt(f -> f.admissionTime().getYear())
            .summaryStatistics();
        if (years.getCount() == 0) {
            return NOT_AVAILABLE;
        }
        return years.getMin() + "-" + years.getMax();
    }

    private static List<Double> knownValues(List<FeatureRecord> group,
                                            Function<FeatureRecord, FeatureValue<Double>> getter) {
        return group.stream()
            .map(getter)
            .filter(FeatureValue::isKnown)
            .map(FeatureValue::get)
            .toList();
    }

    private static String categoryOf(String value) {
        return value == null || value.isBlank() ? UNKNOWN_CATEGORY : value.trim();
    }

    private static List<FeatureRecord> select(List<AnnotatedHospitalization> hospitalizations,
                                              Predicate<AnnotatedHospitalization> filter) {
        return hospitalizations.stream().filter(filter).map(AnnotatedHospitalization::features).toList();
    }

    private static SummaryRow row(String variable, String category, Map<String, List<FeatureRecord>> groups,
                                  Function<List<FeatureRecord>, String> statistic) {
        Map<String, String> values = new LinkedHashMap<>();
        groups.forEach((label, group) -> values.put(label, statistic.apply(group)));
        return new SummaryRow(variable, category, values);
    }
}
