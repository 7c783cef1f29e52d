package io.yasched;

import java.util.Map;

/**
 * Capability invoked when a task fires. Opaque to the scheduler beyond this call.
 */
@FunctionalInterface
public interface Action {

    void execute(Map<String, Object> parameters) throws Exception;
}
