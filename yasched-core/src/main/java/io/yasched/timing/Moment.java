package io.yasched.timing;

import io.yasched.core.InvalidCalendarValueException;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAccessor;
import java.util.Objects;

/**
 * A naive instant: a {@link CalendarDate} plus a {@link TimeOfDay}, no zone.
 *
 * <p>Moments are totally ordered by (date, time). Arithmetic carries across day,
 * month and year boundaries, leap years included, and returns new values.
 *
 * <p>A Moment may also serve as a container for an elapsed duration, see
 * {@link #toElapsedDuration()}.
 */
public final class Moment implements Comparable<Moment> {

    private static final long SECONDS_PER_DAY = 86_400L;

    private final LocalDateTime dateTime;

    private Moment(LocalDateTime dateTime) {
        this.dateTime = dateTime;
    }

    public static Moment of(int year, int month, int day) {
        return of(year, month, day, 0, 0, 0);
    }

    /**
     * @throws InvalidCalendarValueException if the fields do not form a valid date and time
     */
    public static Moment of(int year, int month, int day, int hour, int minute, int second) {
        try {
            return new Moment(LocalDateTime.of(year, month, day, hour, minute, second));
        } catch (DateTimeException e) {
            throw new InvalidCalendarValueException(
                    String.format("Invalid moment: %d-%d-%d %d:%d:%d", year, month, day, hour, minute, second), e);
        }
    }

    public static Moment of(CalendarDate date, TimeOfDay time) {
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(time, "time must not be null");
        return new Moment(LocalDateTime.of(date.toLocalDate(), time.toLocalTime()));
    }

    public static Moment from(LocalDateTime dateTime) {
        Objects.requireNonNull(dateTime, "dateTime must not be null");
        return new Moment(dateTime.truncatedTo(ChronoUnit.SECONDS));
    }

    /**
     * Current wall-clock moment of {@code clock}'s zone, truncated to the second.
     */
    public static Moment now(Clock clock) {
        Objects.requireNonNull(clock, "clock must not be null");
        return from(LocalDateTime.now(clock));
    }

    /**
     * Parses {@code text} with the default {@code uuuu-MM-dd HH:mm:ss} pattern.
     */
    public static Moment parse(String text) {
        return parse(text, Patterns.DATE_TIME);
    }

    /**
     * Parses {@code text} with {@code pattern}. A pattern without time fields yields midnight.
     */
    public static Moment parse(String text, String pattern) {
        Objects.requireNonNull(text, "text must not be null");
        try {
            TemporalAccessor parsed = Patterns.forDate(pattern).parseBest(text, LocalDateTime::from, LocalDate::from);
            if (parsed instanceof LocalDate) {
                return from(((LocalDate) parsed).atStartOfDay());
            }
            return from((LocalDateTime) parsed);
        } catch (DateTimeException e) {
            throw new InvalidCalendarValueException(
                    "Invalid moment string '" + text + "' with pattern '" + pattern + "'", e);
        }
    }

    public CalendarDate date() {
        return CalendarDate.from(dateTime.toLocalDate());
    }

    public TimeOfDay time() {
        return TimeOfDay.from(dateTime.toLocalTime());
    }

    public int hour() {
        return dateTime.getHour();
    }

    public int minute() {
        return dateTime.getMinute();
    }

    public int second() {
        return dateTime.getSecond();
    }

    public Moment plusSeconds(long seconds) {
        return new Moment(dateTime.plusSeconds(seconds));
    }

    /**
     * Adds an exact elapsed duration. Sub-second parts are ignored.
     */
    public Moment plus(Duration duration) {
        Objects.requireNonNull(duration, "duration must not be null");
        return plusSeconds(duration.getSeconds());
    }

    /**
     * Adds {@code other} read as an elapsed duration, see {@link #toElapsedDuration()}.
     */
    public Moment plusElapsed(Moment other) {
        Objects.requireNonNull(other, "other must not be null");
        return plus(other.toElapsedDuration());
    }

    /**
     * Best-effort decoding of this moment as an elapsed duration.
     *
     * <p>Years count as 365 days and months as 30 days, measured from 1970-01-01:
     * {@code days = (year - 1970) * 365 + (month - 1) * 30 + (day - 1)}, then
     * {@code seconds = days * 86400 + hour * 3600 + minute * 60 + second}. This is
     * not calendar arithmetic and is kept as-is so existing offsets enumerate the
     * same occurrences.
     */
    public Duration toElapsedDuration() {
        long days = (dateTime.getYear() - 1970L) * 365L
                + (dateTime.getMonthValue() - 1L) * 30L
                + (dateTime.getDayOfMonth() - 1L);
        long seconds = days * SECONDS_PER_DAY
                + dateTime.getHour() * 3600L
                + dateTime.getMinute() * 60L
                + dateTime.getSecond();
        return Duration.ofSeconds(seconds);
    }

    /**
     * Signed number of seconds from this moment to {@code other}.
     */
    public long secondsUntil(Moment other) {
        Objects.requireNonNull(other, "other must not be null");
        return ChronoUnit.SECONDS.between(dateTime, other.dateTime);
    }

    public boolean isBefore(Moment other) {
        return compareTo(other) < 0;
    }

    public boolean isAfter(Moment other) {
        return compareTo(other) > 0;
    }

    public LocalDateTime toLocalDateTime() {
        return dateTime;
    }

    public String format() {
        return format(Patterns.DATE_TIME);
    }

    public String format(String pattern) {
        return dateTime.format(Patterns.forDate(pattern));
    }

    @Override
    public int compareTo(Moment other) {
        return dateTime.compareTo(other.dateTime);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Moment other)) return false;
        return dateTime.equals(other.dateTime);
    }

    @Override
    public int hashCode() {
        return dateTime.hashCode();
    }

    @Override
    public String toString() {
        return format();
    }
}
