package com.donorid.model.feature;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A derived feature that is either known or explicitly unknown.
 * Unknown is distinct from a known negative and never carries a value.
 */
public final class FeatureValue<T> {

    private final T value;

    private FeatureValue(T value) {
        this.value = value;
    }

    public static <T> FeatureValue<T> known(T value) {
        return new FeatureValue<>(Objects.requireNonNull(value, "value"));
    }

    public static <T> FeatureValue<T> unknown() {
        return new FeatureValue<>(null);
    }

    /**
     * Known when {@code value} is non-null, unknown otherwise.
     */
    public static <T> FeatureValue<T> ofNullable(T value) {
        return value == null ? unknown() : known(value);
    }

    public boolean isKnown() {
        return value != null;
    }

    public T get() {
        if (value == null) {
            throw new IllegalStateException("Feature value is unknown");
        }
        return value;
    }

    public T orElse(T fallback) {
        return value != null ? value : fallback;
    }

    public <R> FeatureValue<R> map(Function<? super T, ? extends R> mapper) {
        return value == null ? unknown() : ofNullable(mapper.apply(value));
    }

    /**
     * Tests a known value; unknown values yield {@code whenUnknown}.
     */
    public boolean test(Predicate<? super T> predicate, boolean whenUnknown) {
        return value == null ? whenUnknown : predicate.test(value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureValue<?> other)) return false;
        return Objects.equals(value, other.value);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(value);
    }

    @Override
    public String toString() {
        return value == null ? "unknown" : String.valueOf(value);
    }
}
