package io.yasched.core;

/**
 * Wraps a failure thrown by a task's action, attributed to that task.
 */
public class ActionExecutionException extends YaschedException {

    private final String taskName;

    public ActionExecutionException(String taskName, Throwable cause) {
        super("Error executing task '" + taskName + "': " + cause.getMessage(), cause);
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
