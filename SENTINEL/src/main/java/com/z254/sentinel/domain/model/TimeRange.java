package com.z254.sentinel.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open time interval {@code [start, end)} used for metric queries.
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Time range end " + end + " is before start " + start);
        }
    }

    /**
     * Range of the given length ending at {@code end}.
     */
    public static TimeRange endingAt(Instant end, Duration length) {
        return new TimeRange(end.minus(length), end);
    }

    public Duration length() {
        return Duration.between(start, end);
    }

    /**
     * The interval of identical length immediately before this one.
     */
    public TimeRange preceding() {
        return new TimeRange(start.minus(length()), start);
    }
}
