package io.yasched.trigger;

import io.yasched.timing.Moment;
import io.yasched.timing.TimeOfDay;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Fires once on each {@code day}: inside the window opening at {@code at}, or
 * anytime that day when no time is given.
 */
public record WeekdayTrigger(DayOfWeek day, TimeOfDay at, Duration window) implements Trigger {

    public WeekdayTrigger {
        Objects.requireNonNull(day, "day must not be null");
        Objects.requireNonNull(window, "window must not be null");
        RecurrenceParser.checkWindow(window);
    }

    public Optional<TimeOfDay> time() {
        return Optional.ofNullable(at);
    }

    @Override
    public boolean isDue(Moment now, Moment lastRun) {
        Objects.requireNonNull(now, "now must not be null");
        return WallClockWindow.isDue(now, lastRun, at, window, date -> date.dayOfWeek() == day);
    }

    @Override
    public Moment nextDue(Moment now, Moment lastRun) {
        Objects.requireNonNull(now, "now must not be null");
        return WallClockWindow.nextDue(now, lastRun, at, window, date -> date.dayOfWeek() == day, 8);
    }

    @Override
    public String toString() {
        String name = "every " + day.name().toLowerCase(Locale.ROOT);
        return at == null ? name : String.format("%s at %02d:%02d", name, at.hour(), at.minute());
    }
}
