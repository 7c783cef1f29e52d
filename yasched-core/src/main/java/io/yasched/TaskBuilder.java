package io.yasched;

import io.yasched.core.TaskInfo;
import io.yasched.core.TaskSpec;

import java.util.Map;

/**
 * Fluent builder for configuring a task before registering it.
 *
 * <p>Note:
 * <ul>
 *   <li>build(): returns an in-memory task spec</li>
 *   <li>register(): build() + register with the owning scheduler</li>
 * </ul>
 */
public interface TaskBuilder {

    /**
     * Bind the action capability invoked when the task fires.
     */
    TaskBuilder action(Action action);

    /**
     * Bind an action by name, resolved immediately through the scheduler's {@link ActionResolver}.
     */
    TaskBuilder action(String actionName);

    /**
     * Named arguments forwarded verbatim to the action.
     */
    TaskBuilder parameters(Map<String, Object> parameters);

    TaskBuilder description(String description);

    /**
     * Defaults to true.
     */
    TaskBuilder enabled(boolean enabled);

    TaskSpec build();

    TaskInfo register();
}
