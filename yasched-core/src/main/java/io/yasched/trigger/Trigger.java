package io.yasched.trigger;

import io.yasched.timing.Moment;

/**
 * Runtime predicate derived from a recurrence phrase.
 *
 * <p>Triggers hold no run state: the last run is passed in by the caller.
 * Boundaries are inclusive, a trigger is due exactly when its interval has
 * elapsed or its window opens.
 *
 * <ul>
 *   <li>{@link FixedIntervalTrigger} - "every 2 hours"</li>
 *   <li>{@link DailyTrigger} - "every day", "every day at 10:30"</li>
 *   <li>{@link WeekdayTrigger} - "every monday", "every monday at 15:00"</li>
 * </ul>
 */
public sealed interface Trigger permits FixedIntervalTrigger, DailyTrigger, WeekdayTrigger {

    /**
     * @param now     current wall-clock moment
     * @param lastRun moment of the last attempted run, or {@code null} if never run
     */
    boolean isDue(Moment now, Moment lastRun);

    /**
     * Earliest moment at or after {@code now} at which this trigger is due,
     * assuming no run happens in between.
     */
    Moment nextDue(Moment now, Moment lastRun);
}
