package io.yasched.core;

import io.yasched.timing.Moment;

/**
 * Point-in-time view of a registered task.
 *
 * @param lastRun     moment of the last attempted run, null if never run
 * @param nextRunHint earliest moment the trigger is expected to be due, null if unknown
 * @param lastError   message of the last contained failure, null if the last run succeeded
 */
public record TaskInfo(
        String name,
        String schedule,
        String description,
        boolean enabled,
        long runCount,
        Moment lastRun,
        Moment nextRunHint,
        String lastError
) {
}
