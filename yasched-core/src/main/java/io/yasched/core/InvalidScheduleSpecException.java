package io.yasched.core;

/**
 * Raised when a recurrence phrase does not match the schedule grammar.
 */
public class InvalidScheduleSpecException extends YaschedException {

    private final String spec;

    public InvalidScheduleSpecException(String spec, String reason) {
        super("Invalid schedule specification '" + spec + "': " + reason);
        this.spec = spec;
    }

    /**
     * The offending phrase, as given by the caller.
     */
    public String spec() {
        return spec;
    }
}
