package com.donorid.model.window;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Closed interval [start, end] used to scope event rows before aggregation.
 */
public record TimeWindow(LocalDateTime start, LocalDateTime end) {

    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Window start " + start + " is after end " + end);
        }
    }

    /**
     * Window of the given length ending at {@code end}.
     */
    public static TimeWindow lookback(LocalDateTime end, Duration length) {
        return new TimeWindow(end.minus(length), end);
    }

    /**
     * Both bounds inclusive. Null timestamps are never inside a window.
     */
    public boolean contains(LocalDateTime timestamp) {
        return timestamp != null && !timestamp.isBefore(start) && !timestamp.isAfter(end);
    }
}
