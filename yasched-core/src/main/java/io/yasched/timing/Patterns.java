package io.yasched.timing;

import io.yasched.core.InvalidCalendarValueException;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.ResolverStyle;
import java.time.temporal.ChronoField;
import java.util.Objects;

/**
 * Builds strict {@link DateTimeFormatter}s from user supplied patterns.
 */
final class Patterns {

    static final String DATE = "uuuu-MM-dd";
    static final String TIME = "HH:mm:ss";
    static final String DATE_TIME = "uuuu-MM-dd HH:mm:ss";

    private Patterns() {
    }

    /**
     * Strict formatter for patterns carrying a date part. ERA defaults to CE so
     * that {@code yyyy} patterns resolve under strict mode.
     */
    static DateTimeFormatter forDate(String pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        try {
            return new DateTimeFormatterBuilder()
                    .appendPattern(pattern)
                    .parseDefaulting(ChronoField.ERA, 1)
                    .toFormatter()
                    .withResolverStyle(ResolverStyle.STRICT);
        } catch (IllegalArgumentException e) {
            throw new InvalidCalendarValueException("Invalid pattern: " + pattern, e);
        }
    }

    static DateTimeFormatter forTime(String pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        try {
            return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
        } catch (IllegalArgumentException e) {
            throw new InvalidCalendarValueException("Invalid pattern: " + pattern, e);
        }
    }
}
