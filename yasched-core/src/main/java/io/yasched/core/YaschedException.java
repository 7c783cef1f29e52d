package io.yasched.core;

/**
 * Base type of every error raised by the scheduler.
 */
public class YaschedException extends RuntimeException {

    public YaschedException(String message) {
        super(message);
    }

    public YaschedException(String message, Throwable cause) {
        super(message, cause);
    }
}
