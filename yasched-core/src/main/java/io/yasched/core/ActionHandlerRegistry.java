package io.yasched.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.yasched.Action;
import io.yasched.ActionHandler;
import io.yasched.ActionResolver;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Named {@link ActionHandler}s, adapted into {@link Action}s on resolution.
 *
 * <p>The parameter mapping is converted to the handler's parameter class with
 * Jackson when the action runs, so a bad mapping surfaces as an action failure.
 */
public class ActionHandlerRegistry implements ActionResolver {

    private final Map<String, ActionHandler<?>> handlersByName;
    private final ObjectMapper objectMapper;

    public ActionHandlerRegistry(List<ActionHandler<?>> handlers, ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.handlersByName = handlers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        ActionHandler::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate ActionHandler name: " + a.name());
                        }
                ));
    }

    public ActionHandler<?> getRequired(String name) {
        ActionHandler<?> handler = handlersByName.get(name);
        if (handler == null) {
            throw new UnknownActionException(name);
        }
        return handler;
    }

    public boolean contains(String name) {
        return handlersByName.containsKey(name);
    }

    @Override
    public Action resolve(String name) {
        Objects.requireNonNull(name, "action name must not be null");
        ActionHandler<?> handler = getRequired(name);
        return parameters -> executeHandler(handler, parameters);
    }

    private <T> void executeHandler(ActionHandler<T> handler, Map<String, Object> parameters) throws Exception {
        Class<T> type = handler.parameterClass();
        T data = (type == null || type == Void.class)
                ? null
                : objectMapper.convertValue(parameters == null ? Map.of() : parameters, type);
        handler.execute(data);
    }
}
