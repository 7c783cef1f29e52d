package io.yasched.trigger;

import io.yasched.core.InvalidCalendarValueException;
import io.yasched.core.InvalidScheduleSpecException;
import io.yasched.timing.TimeOfDay;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses recurrence phrases into {@link Trigger}s.
 * <p>
 * Supported formats (case insensitive, whitespace delimited):
 * <ul>
 *   <li>"every hour", "every 2 hours", "every 30 seconds", "every 3 weeks"</li>
 *   <li>"every day", "every day at 10:30"</li>
 *   <li>"every monday", "every friday at 15:00"</li>
 * </ul>
 * <p>
 * "every day" without a time runs every 24 hours, like "every days" and
 * "every 1 day"; only "every day at HH:MM" is anchored to the wall clock.
 */
public final class RecurrenceParser {

    /**
     * Default length of the window opened by "at HH:MM" phrases.
     */
    public static final Duration DEFAULT_MATCH_WINDOW = Duration.ofMinutes(1);

    private static final Pattern INTEGER = Pattern.compile("^\\d+$");
    private static final Pattern HH_MM = Pattern.compile("^(\\d{2}):(\\d{2})$");

    private static final Map<String, DayOfWeek> DAY_NAMES = Map.of(
            "monday", DayOfWeek.MONDAY,
            "tuesday", DayOfWeek.TUESDAY,
            "wednesday", DayOfWeek.WEDNESDAY,
            "thursday", DayOfWeek.THURSDAY,
            "friday", DayOfWeek.FRIDAY,
            "saturday", DayOfWeek.SATURDAY,
            "sunday", DayOfWeek.SUNDAY
    );

    private RecurrenceParser() {
    }

    public static Trigger parse(String spec) {
        return parse(spec, DEFAULT_MATCH_WINDOW);
    }

    /**
     * @param spec        recurrence phrase
     * @param matchWindow window length for "at HH:MM" phrases
     * @throws InvalidScheduleSpecException if the phrase does not match the grammar
     */
    public static Trigger parse(String spec, Duration matchWindow) {
        if (spec == null) {
            throw new InvalidScheduleSpecException(null, "spec must not be null");
        }
        checkWindow(matchWindow);

        String s = spec.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new InvalidScheduleSpecException(spec, "spec must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (!"every".equals(parts[0])) {
            throw new InvalidScheduleSpecException(spec, "expected 'every' but found '" + parts[0] + "'");
        }
        if (parts.length < 2) {
            throw new InvalidScheduleSpecException(spec, "missing unit after 'every'");
        }

        if (INTEGER.matcher(parts[1]).matches()) {
            return parseFixedInterval(spec, parts);
        }

        String head = parts[1];
        TimeOfDay at = null;
        if (parts.length == 4 && "at".equals(parts[2])) {
            at = parseTimeOfDay(spec, parts[3]);
        } else if (parts.length != 2) {
            throw new InvalidScheduleSpecException(spec, "unexpected trailing tokens");
        }

        if ("day".equals(head)) {
            return new DailyTrigger(at, matchWindow);
        }
        DayOfWeek day = DAY_NAMES.get(head);
        if (day != null) {
            return new WeekdayTrigger(day, at, matchWindow);
        }
        if (at != null) {
            throw new InvalidScheduleSpecException(spec, "'at' requires 'day' or a day name, found '" + head + "'");
        }
        return IntervalUnit.parse(head)
                .map(unit -> (Trigger) new FixedIntervalTrigger(1, unit))
                .orElseThrow(() -> new InvalidScheduleSpecException(spec, "unknown schedule unit '" + head + "'"));
    }

    static void checkWindow(Duration window) {
        if (window == null || window.getSeconds() <= 0 || window.compareTo(Duration.ofDays(1)) > 0) {
            throw new IllegalArgumentException("match window must be between 1 second and 1 day: " + window);
        }
    }

    private static Trigger parseFixedInterval(String spec, String[] parts) {
        if (parts.length != 3) {
            throw new InvalidScheduleSpecException(spec, "expected 'every <n> <unit>'");
        }
        IntervalUnit unit = IntervalUnit.parse(parts[2])
                .orElseThrow(() -> new InvalidScheduleSpecException(spec, "unknown time unit '" + parts[2] + "'"));
        long amount;
        try {
            amount = Long.parseLong(parts[1]);
        } catch (NumberFormatException ex) {
            throw new InvalidScheduleSpecException(spec, "interval out of range: " + parts[1]);
        }
        if (amount <= 0) {
            throw new InvalidScheduleSpecException(spec, "interval must be positive");
        }
        try {
            return new FixedIntervalTrigger(amount, unit);
        } catch (IllegalArgumentException ex) {
            throw new InvalidScheduleSpecException(spec, "interval out of range: " + parts[1]);
        }
    }

    private static TimeOfDay parseTimeOfDay(String spec, String token) {
        Matcher m = HH_MM.matcher(token);
        if (!m.matches()) {
            throw new InvalidScheduleSpecException(spec, "invalid time '" + token + "', expected HH:MM");
        }
        try {
            return TimeOfDay.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        } catch (InvalidCalendarValueException ex) {
            throw new InvalidScheduleSpecException(spec, "invalid time '" + token + "'");
        }
    }
}
