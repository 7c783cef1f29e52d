package io.yasched.core;

import java.util.Map;

/**
 * Task descriptor as read from configuration: the action is referenced by name.
 *
 * @param name        unique task name, required
 * @param schedule    recurrence phrase, required
 * @param action      action name resolved through an ActionResolver, required
 * @param description optional free text
 * @param enabled     whether the task starts enabled
 * @param parameters  forwarded verbatim to the action as named arguments
 */
public record TaskDefinition(
        String name,
        String schedule,
        String action,
        String description,
        boolean enabled,
        Map<String, Object> parameters
) {
    public TaskDefinition(String name, String schedule, String action) {
        this(name, schedule, action, null, true, Map.of());
    }
}
