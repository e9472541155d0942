package com.behavior.affinity.core.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Half-open time window {@code [start, end)}.
 */
public record TimeWindow(Instant start, Instant end) {

    public TimeWindow {
        Objects.requireNonNull(start, "start is required");
        Objects.requireNonNull(end, "end is required");
        if (!start.isBefore(end)) {
            throw new IllegalArgumentException("window start " + start + " must precede end " + end);
        }
    }

    public static TimeWindow of(Instant start, Instant end) {
        return new TimeWindow(start, end);
    }

    /**
     * The last complete clock hour before {@code now}: at 10:45 this is
     * {@code [09:00, 10:00)}.
     */
    public static TimeWindow previousHour(Instant now) {
        Instant end = now.truncatedTo(ChronoUnit.HOURS);
        return new TimeWindow(end.minus(1, ChronoUnit.HOURS), end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
