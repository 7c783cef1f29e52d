package io.yasched.timing;

import io.yasched.core.InvalidCalendarValueException;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A calendar day with no time-of-day and no zone.
 *
 * <p>Instances are immutable; arithmetic returns new values.
 */
public final class CalendarDate implements Comparable<CalendarDate> {

    private final LocalDate date;

    private CalendarDate(LocalDate date) {
        this.date = date;
    }

    /**
     * @throws InvalidCalendarValueException if the fields do not form a valid Gregorian date
     */
    public static CalendarDate of(int year, int month, int day) {
        try {
            return new CalendarDate(LocalDate.of(year, month, day));
        } catch (DateTimeException e) {
            throw new InvalidCalendarValueException(
                    "Invalid date: year=" + year + ", month=" + month + ", day=" + day, e);
        }
    }

    public static CalendarDate from(LocalDate date) {
        return new CalendarDate(Objects.requireNonNull(date, "date must not be null"));
    }

    public static CalendarDate today(Clock clock) {
        return new CalendarDate(LocalDate.now(clock));
    }

    /**
     * Parses {@code text} with the default {@code uuuu-MM-dd} pattern.
     */
    public static CalendarDate parse(String text) {
        return parse(text, Patterns.DATE);
    }

    public static CalendarDate parse(String text, String pattern) {
        Objects.requireNonNull(text, "text must not be null");
        try {
            return new CalendarDate(LocalDate.parse(text, Patterns.forDate(pattern)));
        } catch (DateTimeException e) {
            throw new InvalidCalendarValueException(
                    "Invalid date string '" + text + "' with pattern '" + pattern + "'", e);
        }
    }

    public int year() {
        return date.getYear();
    }

    public int month() {
        return date.getMonthValue();
    }

    public int day() {
        return date.getDayOfMonth();
    }

    public DayOfWeek dayOfWeek() {
        return date.getDayOfWeek();
    }

    public CalendarDate plusDays(long days) {
        return new CalendarDate(date.plusDays(days));
    }

    public LocalDate toLocalDate() {
        return date;
    }

    public String format(String pattern) {
        return date.format(Patterns.forDate(pattern));
    }

    public boolean isBefore(CalendarDate other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(CalendarDate other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(CalendarDate other) {
        return date.compareTo(other.date);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CalendarDate other)) return false;
        return date.equals(other.date);
    }

    @Override
    public int hashCode() {
        return date.hashCode();
    }

    @Override
    public String toString() {
        return date.toString();
    }
}
