package io.yasched;

/**
 * Named action whose parameter mapping is converted to {@code T} before execution.
 */
public interface ActionHandler<T> {
    String name();

    Class<T> parameterClass();

    void execute(T parameters) throws Exception;
}
