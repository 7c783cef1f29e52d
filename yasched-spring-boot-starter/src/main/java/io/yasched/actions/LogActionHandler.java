package io.yasched.actions;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.yasched.ActionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Built-in "log" action: logs {@code message} at {@code level}
 * (debug, info, warn/warning, error/critical). Unknown levels fall back to info.
 */
public class LogActionHandler implements ActionHandler<LogActionHandler.Parameters> {
    private static final Logger log = LoggerFactory.getLogger(LogActionHandler.class);

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Parameters(String message, String level) {
    }

    @Override
    public String name() {
        return "log";
    }

    @Override
    public Class<Parameters> parameterClass() {
        return Parameters.class;
    }

    @Override
    public void execute(Parameters parameters) {
        String message = parameters == null || parameters.message() == null ? "" : parameters.message();
        String level = parameters == null || parameters.level() == null
                ? "info"
                : parameters.level().toLowerCase(Locale.ROOT);

        switch (level) {
            case "debug" -> log.debug(message);
            case "warn", "warning" -> log.warn(message);
            case "error", "critical" -> log.error(message);
            default -> log.info(message);
        }
    }
}
