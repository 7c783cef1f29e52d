package io.yasched.trigger;

import io.yasched.timing.Moment;

import java.util.Objects;

/**
 * Due when never run, or when at least {@code amount} units elapsed since the last run.
 */
public record FixedIntervalTrigger(long amount, IntervalUnit unit) implements Trigger {

    public FixedIntervalTrigger {
        Objects.requireNonNull(unit, "unit must not be null");
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive: " + amount);
        }
        if (amount > Long.MAX_VALUE / unit.seconds()) {
            throw new IllegalArgumentException("interval too large: " + amount + " " + unit.displayName(amount));
        }
    }

    public long intervalSeconds() {
        return amount * unit.seconds();
    }

    @Override
    public boolean isDue(Moment now, Moment lastRun) {
        Objects.requireNonNull(now, "now must not be null");
        return lastRun == null || lastRun.secondsUntil(now) >= intervalSeconds();
    }

    @Override
    public Moment nextDue(Moment now, Moment lastRun) {
        Objects.requireNonNull(now, "now must not be null");
        if (lastRun == null) {
            return now;
        }
        Moment candidate = lastRun.plusSeconds(intervalSeconds());
        return candidate.isAfter(now) ? candidate : now;
    }

    @Override
    public String toString() {
        return amount == 1
                ? "every " + unit.displayName(1)
                : "every " + amount + " " + unit.displayName(amount);
    }
}
