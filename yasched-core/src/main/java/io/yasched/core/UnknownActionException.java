package io.yasched.core;

public class UnknownActionException extends YaschedException {

    private final String actionName;

    public UnknownActionException(String actionName) {
        super("No ActionHandler registered for name: " + actionName);
        this.actionName = actionName;
    }

    public String actionName() {
        return actionName;
    }
}
