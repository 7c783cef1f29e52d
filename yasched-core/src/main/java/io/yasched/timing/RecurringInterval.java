package io.yasched.timing;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An {@link Interval} repeated by a sequence of offsets up to a boundary.
 *
 * <p>Enumeration starts with the first occurrence. Each tick applies every
 * offset in order to the running start and end; an occurrence is kept while its
 * start does not exceed {@code lastBoundary.start()}. Offsets must be positive
 * whole seconds, which guarantees termination.
 *
 * <p>Typical usage:
 * <pre>{@code
 * Interval first = new Interval(Moment.of(2025, 1, 1, 9, 0, 0), Moment.of(2025, 1, 1, 10, 0, 0));
 * Interval last = new Interval(Moment.of(2025, 1, 5, 9, 0, 0), Moment.of(2025, 1, 5, 10, 0, 0));
 * RecurringInterval.daily(first, last, 2).occurrences(); // Jan 1, 3, 5
 * }</pre>
 */
public final class RecurringInterval {

    private final Interval firstOccurrence;
    private final Interval lastBoundary;
    private final List<Duration> offsets;

    /**
     * @throws IllegalArgumentException if {@code offsets} is empty or holds a
     *                                  zero, negative or sub-second offset
     */
    public RecurringInterval(Interval firstOccurrence, Interval lastBoundary, List<Duration> offsets) {
        this.firstOccurrence = Objects.requireNonNull(firstOccurrence, "firstOccurrence must not be null");
        this.lastBoundary = Objects.requireNonNull(lastBoundary, "lastBoundary must not be null");
        Objects.requireNonNull(offsets, "offsets must not be null");
        if (offsets.isEmpty()) {
            throw new IllegalArgumentException("offsets must not be empty");
        }
        for (Duration offset : offsets) {
            Objects.requireNonNull(offset, "offsets must not contain null");
            if (offset.getSeconds() <= 0) {
                throw new IllegalArgumentException("offset must advance by at least one second: " + offset);
            }
        }
        this.offsets = List.copyOf(offsets);
    }

    /**
     * Builds a recurring interval whose offsets are moments read as elapsed durations.
     *
     * @see Moment#toElapsedDuration()
     */
    public static RecurringInterval ofElapsedOffsets(Interval firstOccurrence, Interval lastBoundary, List<Moment> offsets) {
        Objects.requireNonNull(offsets, "offsets must not be null");
        List<Duration> decoded = new ArrayList<>(offsets.size());
        for (Moment offset : offsets) {
            decoded.add(Objects.requireNonNull(offset, "offsets must not contain null").toElapsedDuration());
        }
        return new RecurringInterval(firstOccurrence, lastBoundary, decoded);
    }

    /**
     * Repeats every {@code intervalDays} days.
     */
    public static RecurringInterval daily(Interval firstOccurrence, Interval lastBoundary, int intervalDays) {
        return new RecurringInterval(firstOccurrence, lastBoundary, List.of(Duration.ofDays(intervalDays)));
    }

    /**
     * Repeats every {@code intervalWeeks} weeks.
     */
    public static RecurringInterval weekly(Interval firstOccurrence, Interval lastBoundary, int intervalWeeks) {
        return new RecurringInterval(firstOccurrence, lastBoundary, List.of(Duration.ofDays(7L * intervalWeeks)));
    }

    /**
     * {@code count} occurrences starting at {@code firstOccurrence}, spaced by {@code interval}.
     * The boundary is derived by applying the interval {@code count - 1} times.
     */
    public static RecurringInterval ofCount(Interval firstOccurrence, Duration interval, int count) {
        Objects.requireNonNull(firstOccurrence, "firstOccurrence must not be null");
        Objects.requireNonNull(interval, "interval must not be null");
        if (count < 1) {
            throw new IllegalArgumentException("count must be at least 1: " + count);
        }
        Moment lastStart = firstOccurrence.start();
        for (int i = 0; i < count - 1; i++) {
            lastStart = lastStart.plus(interval);
        }
        Interval lastBoundary = new Interval(lastStart, lastStart.plusSeconds(firstOccurrence.duration()));
        return new RecurringInterval(firstOccurrence, lastBoundary, List.of(interval));
    }

    public static RecurringInterval ofCount(Interval firstOccurrence, Moment interval, int count) {
        Objects.requireNonNull(interval, "interval must not be null");
        return ofCount(firstOccurrence, interval.toElapsedDuration(), count);
    }

    public Interval firstOccurrence() {
        return firstOccurrence;
    }

    public Interval lastBoundary() {
        return lastBoundary;
    }

    public List<Duration> offsets() {
        return offsets;
    }

    /**
     * All occurrences in order, the first occurrence included.
     */
    public List<Interval> occurrences() {
        List<Interval> occurrences = new ArrayList<>();
        Moment boundary = lastBoundary.start();
        Moment currentStart = firstOccurrence.start();
        Moment currentEnd = firstOccurrence.end();
        occurrences.add(firstOccurrence);

        while (true) {
            for (Duration offset : offsets) {
                currentStart = currentStart.plus(offset);
                currentEnd = currentEnd.plus(offset);
                if (currentStart.isAfter(boundary)) {
                    return Collections.unmodifiableList(occurrences);
                }
                occurrences.add(new Interval(currentStart, currentEnd));
            }
        }
    }

    public int countOccurrences() {
        return occurrences().size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RecurringInterval other)) return false;
        return firstOccurrence.equals(other.firstOccurrence)
                && lastBoundary.equals(other.lastBoundary)
                && offsets.equals(other.offsets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(firstOccurrence, lastBoundary, offsets);
    }

    @Override
    public String toString() {
        return "RecurringInterval(start=" + firstOccurrence + ", end=" + lastBoundary + ", offsets=" + offsets + ")";
    }
}
