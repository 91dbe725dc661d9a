package com.openscheduling.availability.domain.model;

import com.openscheduling.common.exception.InvalidArgumentException;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;

/**
 * Half-open time interval {@code [start, end)}.
 * Intervals that only touch at a boundary do not overlap.
 */
public record TimeInterval(Instant start, Instant end) implements Comparable<TimeInterval> {

    private static final Comparator<TimeInterval> ORDER =
            Comparator.comparing(TimeInterval::start).thenComparing(TimeInterval::end);

    public TimeInterval {
        if (start == null || end == null) {
            throw new InvalidArgumentException("Interval bounds must not be null");
        }
        if (!start.isBefore(end)) {
            throw new InvalidArgumentException(
                    String.format("Interval start %s must be before end %s", start, end));
        }
    }

    public static TimeInterval ofMinutes(Instant start, long minutes) {
        return new TimeInterval(start, start.plus(Duration.ofMinutes(minutes)));
    }

    /**
     * The one overlap test used everywhere: {@code A.start < B.end && B.start < A.end}.
     */
    public boolean overlaps(TimeInterval other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean contains(TimeInterval other) {
        return !other.start.isBefore(start) && !other.end.isAfter(end);
    }

    public Optional<TimeInterval> intersection(TimeInterval other) {
        if (!overlaps(other)) {
            return Optional.empty();
        }
        Instant s = start.isAfter(other.start) ? start : other.start;
        Instant e = end.isBefore(other.end) ? end : other.end;
        return Optional.of(new TimeInterval(s, e));
    }

    /**
     * Widens the interval by {@code padding} on both sides.
     */
    public TimeInterval expand(Duration padding) {
        if (padding.isZero()) {
            return this;
        }
        return new TimeInterval(start.minus(padding), end.plus(padding));
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    @Override
    public int compareTo(TimeInterval other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
