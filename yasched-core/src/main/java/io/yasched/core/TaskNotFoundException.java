package io.yasched.core;

public class TaskNotFoundException extends YaschedException {

    private final String taskName;

    public TaskNotFoundException(String taskName) {
        super("Task '" + taskName + "' not found");
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
