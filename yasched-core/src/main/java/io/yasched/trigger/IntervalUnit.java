package io.yasched.trigger;

import java.util.Locale;
import java.util.Optional;

public enum IntervalUnit {
    SECONDS("second", 1L),
    MINUTES("minute", 60L),
    HOURS("hour", 3_600L),
    DAYS("day", 86_400L),
    WEEKS("week", 604_800L);

    private final String singular;
    private final long seconds;

    IntervalUnit(String singular, long seconds) {
        this.singular = singular;
        this.seconds = seconds;
    }

    /**
     * Length of one unit in seconds.
     */
    public long seconds() {
        return seconds;
    }

    public String displayName(long amount) {
        return amount == 1 ? singular : singular + "s";
    }

    /**
     * Accepts the singular or plural unit name, case insensitive.
     */
    public static Optional<IntervalUnit> parse(String token) {
        String s = token.toLowerCase(Locale.ROOT);
        for (IntervalUnit unit : values()) {
            if (s.equals(unit.singular) || s.equals(unit.singular + "s")) {
                return Optional.of(unit);
            }
        }
        return Optional.empty();
    }
}
