package io.yasched;

import io.yasched.core.ActionExecutionException;
import io.yasched.core.DuplicateTaskNameException;
import io.yasched.core.InvalidScheduleSpecException;
import io.yasched.core.PollResult;
import io.yasched.core.TaskDefinition;
import io.yasched.core.TaskInfo;
import io.yasched.core.TaskNotFoundException;
import io.yasched.core.TaskSpec;
import io.yasched.timing.Moment;

import java.time.Duration;
import java.util.List;

/**
 * Main scheduler API.
 *
 * <p>Owns named tasks bound to a trigger and an action. A cooperative loop
 * ({@link #run(Duration)}) polls the tasks, executes the due ones one at a time and
 * records run statistics. A failing action never stops the loop nor its siblings.
 *
 * <p>Typical usage:
 * <pre>{@code
 * scheduler.create("backup", "every day at 02:00")
 *          .action("print")
 *          .parameters(Map.of("message", "backing up"))
 *          .register();
 *
 * scheduler.run(Duration.ofSeconds(1)); // blocks until stop()
 * }</pre>
 */
public interface Scheduler {

    TaskBuilder create(String name, String schedule);

    /**
     * Register a task. The schedule is parsed synchronously; on failure nothing is registered.
     *
     * @throws DuplicateTaskNameException   if a task with the same name exists
     * @throws InvalidScheduleSpecException if the schedule does not parse
     */
    TaskInfo register(TaskSpec spec);

    /**
     * Register a task from a descriptor, resolving its action by name.
     */
    TaskInfo register(TaskDefinition definition);

    /**
     * @throws TaskNotFoundException if absent
     */
    void remove(String name);

    void enable(String name);

    void disable(String name);

    TaskInfo get(String name);

    /**
     * Snapshots of all tasks, in registration order.
     */
    List<TaskInfo> list();

    void clear();

    /**
     * Execute a task immediately, bypassing its trigger. Disabled tasks are skipped.
     *
     * @return true if the action was attempted
     * @throws ActionExecutionException if the action failed; the run is still recorded
     */
    boolean runNow(String name);

    /**
     * One poll cycle: execute every enabled task that is due at {@code now}.
     * Action failures are contained and reported in the result.
     */
    PollResult pollOnce(Moment now);

    /**
     * Blocking loop of {@link #pollOnce(Moment)} and sleep, until {@link #stop()}.
     */
    void run(Duration pollInterval);

    /**
     * Ask the loop to exit before its next sleep. An in-flight action is never interrupted.
     */
    void stop();

    boolean isRunning();
}
