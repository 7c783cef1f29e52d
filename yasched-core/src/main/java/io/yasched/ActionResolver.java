package io.yasched;

import io.yasched.core.UnknownActionException;

/**
 * Resolves an action name from a task descriptor into an {@link Action}.
 */
@FunctionalInterface
public interface ActionResolver {

    /**
     * @throws UnknownActionException if no action is known under {@code name}
     */
    Action resolve(String name);
}
