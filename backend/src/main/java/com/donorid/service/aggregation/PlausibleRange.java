package com.donorid.service.aggregation;

/**
 * Inclusive range of physiologically plausible values for one category.
 */
public record PlausibleRange(double min, double max) {

    public PlausibleRange {
        if (min > max) {
            throw new IllegalArgumentException("Plausible range min " + min + " > max " + max);
        }
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }
}
