package io.yasched.internal;

import io.yasched.Action;
import io.yasched.ActionResolver;
import io.yasched.TaskBuilder;
import io.yasched.core.TaskInfo;
import io.yasched.core.TaskSpec;

import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link TaskBuilder} implementation used by {@link PollingScheduler}.
 */
public class SimpleTaskBuilder implements TaskBuilder {

    private final String name;
    private final String schedule;
    private final ActionResolver resolver;
    private final Function<TaskSpec, TaskInfo> registrar;

    private Action action;
    private Map<String, Object> parameters = Map.of();
    private String description;
    private boolean enabled = true;

    public SimpleTaskBuilder(String name, String schedule, ActionResolver resolver, Function<TaskSpec, TaskInfo> registrar) {
        this.name = Objects.requireNonNull(name, "task name must not be null");
        this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.registrar = Objects.requireNonNull(registrar, "registrar must not be null");
    }

    @Override
    public TaskBuilder action(Action action) {
        this.action = Objects.requireNonNull(action, "action must not be null");
        return this;
    }

    @Override
    public TaskBuilder action(String actionName) {
        Objects.requireNonNull(actionName, "actionName must not be null");
        if (actionName.isBlank()) throw new IllegalArgumentException("actionName must not be blank");

        this.action = resolver.resolve(actionName);
        return this;
    }

    @Override
    public TaskBuilder parameters(Map<String, Object> parameters) {
        Objects.requireNonNull(parameters, "parameters must not be null");
        for (var e : parameters.entrySet()) {
            String k = e.getKey();
            if (k == null || k.isBlank()) {
                throw new IllegalArgumentException("parameters contain blank key");
            }
        }
        this.parameters = parameters;
        return this;
    }

    @Override
    public TaskBuilder description(String description) {
        this.description = description;
        return this;
    }

    @Override
    public TaskBuilder enabled(boolean enabled) {
        this.enabled = enabled;
        return this;
    }

    @Override
    public TaskSpec build() {
        if (action == null) {
            throw new IllegalStateException("action must be set before building task: " + name);
        }
        return new TaskSpec(
                name,
                schedule,
                action,
                parameters,
                description,
                enabled
        );
    }

    @Override
    public TaskInfo register() {
        return registrar.apply(build());
    }
}
