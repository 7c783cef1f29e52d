package io.yasched.core;

/**
 * Raised when fields or text do not form a valid calendar date or time of day.
 */
public class InvalidCalendarValueException extends YaschedException {

    public InvalidCalendarValueException(String message) {
        super(message);
    }

    public InvalidCalendarValueException(String message, Throwable cause) {
        super(message, cause);
    }
}
