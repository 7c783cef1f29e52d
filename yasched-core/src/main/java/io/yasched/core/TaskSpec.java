package io.yasched.core;

import io.yasched.Action;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable task definition produced by TaskBuilder.build().
 * The action is already resolved; no name lookup happens after this point.
 */
public record TaskSpec(
        String name,
        String schedule,
        Action action,
        Map<String, Object> parameters,
        String description,
        boolean enabled
) {
    public TaskSpec {
        Objects.requireNonNull(name, "task name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("task name must not be blank");
        }
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(action, "action must not be null");
        parameters = (parameters == null || parameters.isEmpty())
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
