package io.yasched.timing;

import java.time.Duration;
import java.util.Objects;

/**
 * A pair of moments delimiting a time slot. Ordered by start.
 *
 * <p>The end is not required to follow the start; {@link #duration()} is then negative.
 */
public final class Interval implements Comparable<Interval> {

    private final Moment start;
    private final Moment end;

    public Interval(Moment start, Moment end) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
    }

    public static Interval ofDuration(Moment start, Duration duration) {
        return new Interval(start, start.plus(duration));
    }

    /**
     * Builds an interval whose length is {@code duration} read as an elapsed duration.
     *
     * @see Moment#toElapsedDuration()
     */
    public static Interval ofDuration(Moment start, Moment duration) {
        return new Interval(start, start.plusElapsed(duration));
    }

    public Moment start() {
        return start;
    }

    public Moment end() {
        return end;
    }

    /**
     * end - start, in seconds.
     */
    public long duration() {
        return start.secondsUntil(end);
    }

    /**
     * Same length, shifted by {@code offset}.
     */
    public Interval shift(Duration offset) {
        return new Interval(start.plus(offset), end.plus(offset));
    }

    public String format(String pattern) {
        return start.format(pattern) + " - " + end.format(pattern);
    }

    @Override
    public int compareTo(Interval other) {
        return start.compareTo(other.start);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Interval other)) return false;
        return start.equals(other.start) && end.equals(other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return start + " - " + end;
    }
}
