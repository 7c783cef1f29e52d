package io.yasched.timing;

import io.yasched.core.InvalidCalendarValueException;

import java.time.DateTimeException;
import java.time.LocalTime;
import java.util.Objects;

/**
 * A wall-clock time with second precision: hour 0-23, minute 0-59, second 0-59.
 */
public final class TimeOfDay implements Comparable<TimeOfDay> {

    public static final TimeOfDay MIDNIGHT = new TimeOfDay(LocalTime.MIDNIGHT);

    private final LocalTime time;

    private TimeOfDay(LocalTime time) {
        this.time = time;
    }

    public static TimeOfDay of(int hour, int minute) {
        return of(hour, minute, 0);
    }

    /**
     * @throws InvalidCalendarValueException if any field is out of range
     */
    public static TimeOfDay of(int hour, int minute, int second) {
        try {
            return new TimeOfDay(LocalTime.of(hour, minute, second));
        } catch (DateTimeException e) {
            throw new InvalidCalendarValueException(
                    "Invalid time: hour=" + hour + ", minute=" + minute + ", second=" + second, e);
        }
    }

    public static TimeOfDay from(LocalTime time) {
        Objects.requireNonNull(time, "time must not be null");
        return new TimeOfDay(time.withNano(0));
    }

    public static TimeOfDay parse(String text) {
        return parse(text, Patterns.TIME);
    }

    public static TimeOfDay parse(String text, String pattern) {
        Objects.requireNonNull(text, "text must not be null");
        try {
            return new TimeOfDay(LocalTime.parse(text, Patterns.forTime(pattern)));
        } catch (DateTimeException e) {
            throw new InvalidCalendarValueException(
                    "Invalid time string '" + text + "' with pattern '" + pattern + "'", e);
        }
    }

    public int hour() {
        return time.getHour();
    }

    public int minute() {
        return time.getMinute();
    }

    public int second() {
        return time.getSecond();
    }

    /**
     * Seconds elapsed since midnight.
     */
    public int toSecondOfDay() {
        return time.toSecondOfDay();
    }

    public LocalTime toLocalTime() {
        return time;
    }

    public String format(String pattern) {
        return time.format(Patterns.forTime(pattern));
    }

    @Override
    public int compareTo(TimeOfDay other) {
        return time.compareTo(other.time);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeOfDay other)) return false;
        return time.equals(other.time);
    }

    @Override
    public int hashCode() {
        return time.hashCode();
    }

    @Override
    public String toString() {
        return String.format("%02d:%02d:%02d", hour(), minute(), second());
    }
}
