package io.yasched.internal;

import io.yasched.Action;
import io.yasched.core.TaskInfo;
import io.yasched.core.TaskSpec;
import io.yasched.timing.Moment;
import io.yasched.trigger.Trigger;

import java.util.Map;

/**
 * A registered task and its run state. Mutable fields are guarded by the owning
 * scheduler's lock.
 */
final class ScheduledTask {

    private final TaskSpec spec;
    private final Trigger trigger;

    private boolean enabled;
    private long runCount;
    private Moment lastRun;
    private Moment nextRunHint;
    private String lastError;

    ScheduledTask(TaskSpec spec, Trigger trigger, Moment nextRunHint) {
        this.spec = spec;
        this.trigger = trigger;
        this.enabled = spec.enabled();
        this.nextRunHint = nextRunHint;
    }

    String name() {
        return spec.name();
    }

    Action action() {
        return spec.action();
    }

    Map<String, Object> parameters() {
        return spec.parameters();
    }

    Trigger trigger() {
        return trigger;
    }

    boolean isEnabled() {
        return enabled;
    }

    void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    Moment lastRun() {
        return lastRun;
    }

    /**
     * Counts an attempted run, successful or not.
     */
    void recordRun(Moment at, String error) {
        this.runCount++;
        this.lastRun = at;
        this.lastError = error;
        this.nextRunHint = trigger.nextDue(at, at);
    }

    TaskInfo toInfo() {
        return new TaskInfo(
                spec.name(),
                spec.schedule(),
                spec.description(),
                enabled,
                runCount,
                lastRun,
                nextRunHint,
                lastError
        );
    }
}
