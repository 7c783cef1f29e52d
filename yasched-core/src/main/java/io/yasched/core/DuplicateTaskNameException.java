package io.yasched.core;

public class DuplicateTaskNameException extends YaschedException {

    private final String taskName;

    public DuplicateTaskNameException(String taskName) {
        super("Task with name '" + taskName + "' already exists");
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
