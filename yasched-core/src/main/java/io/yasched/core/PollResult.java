package io.yasched.core;

import java.util.List;

/**
 * Outcome of one poll cycle.
 *
 * executed : names of tasks whose action was attempted, in execution order
 * failures : contained action failures, one per failing task
 */
public record PollResult(
        List<String> executed,
        List<ActionExecutionException> failures
) {
    public PollResult {
        executed = List.copyOf(executed);
        failures = List.copyOf(failures);
    }

    public static PollResult empty() {
        return new PollResult(List.of(), List.of());
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
