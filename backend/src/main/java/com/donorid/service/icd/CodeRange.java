package com.donorid.service.icd;

/**
 * Inclusive range of ICD-10 code prefixes, e.g. I20 through I25.
 * A code matches when its leading characters, truncated to each bound's length, fall between the bounds.
 * A single code ("R6520" to "R6520") matches that code and all of its children.
 */
public record CodeRange(String from, String to) {

    public CodeRange {
        from = Icd10CodeNormalizer.normalize(from);
        to = Icd10CodeNormalizer.normalize(to);
        if (from.isEmpty() || to.isEmpty()) {
            throw new IllegalArgumentException("Code range bounds must not be empty");
        }
        if (from.compareTo(to.substring(0, Math.min(to.length(), from.length()))) > 0) {
            throw new IllegalArgumentException("Code range " + from + " > " + to);
        }
    }

    /**
     * Each bound is compared against the code's prefix of the bound's length. A code shorter than the upper bound
     * is compared against the upper bound cut to the code's length; a code shorter than the lower bound never
     * matches ("I2" is not in I21 to I25).
     *
     * @param normalizedCode a code already passed through {@link Icd10CodeNormalizer}
     */
    public boolean matches(String normalizedCode) {
        if (normalizedCode.length() < from.length()) {
            return false;
        }
        String upper = to.length() > normalizedCode.length() ? to.substring(0, normalizedCode.length()) : to;
        return normalizedCode.substring(0, from.length()).compareTo(from) >= 0
            && normalizedCode.substring(0, upper.length()).compareTo(upper) <= 0;
    }
}
