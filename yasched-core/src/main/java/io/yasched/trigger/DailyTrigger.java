package io.yasched.trigger;

import io.yasched.timing.Moment;
import io.yasched.timing.TimeOfDay;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires once a day: inside the window opening at {@code at}, or every 24 hours
 * since the last run when no time is given.
 *
 * @param at     time the window opens, {@code null} for any time of day
 * @param window window length, ignored when {@code at} is null
 */
public record DailyTrigger(TimeOfDay at, Duration window) implements Trigger {

    private static final FixedIntervalTrigger EVERY_24_HOURS = new FixedIntervalTrigger(1, IntervalUnit.DAYS);

    public DailyTrigger {
        Objects.requireNonNull(window, "window must not be null");
        RecurrenceParser.checkWindow(window);
    }

    public Optional<TimeOfDay> time() {
        return Optional.ofNullable(at);
    }

    @Override
    public boolean isDue(Moment now, Moment lastRun) {
        Objects.requireNonNull(now, "now must not be null");
        if (at == null) {
            return EVERY_24_HOURS.isDue(now, lastRun);
        }
        return WallClockWindow.isDue(now, lastRun, at, window, date -> true);
    }

    @Override
    public Moment nextDue(Moment now, Moment lastRun) {
        Objects.requireNonNull(now, "now must not be null");
        if (at == null) {
            return EVERY_24_HOURS.nextDue(now, lastRun);
        }
        return WallClockWindow.nextDue(now, lastRun, at, window, date -> true, 2);
    }

    @Override
    public String toString() {
        return at == null
                ? "every day"
                : String.format("every day at %02d:%02d", at.hour(), at.minute());
    }
}
