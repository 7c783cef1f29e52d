package io.yasched.actions;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.yasched.Action;
import io.yasched.ActionHandler;
import io.yasched.core.ActionHandlerRegistry;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class BuiltInActionHandlersTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final ActionHandlerRegistry registry = new ActionHandlerRegistry(
            List.<ActionHandler<?>>of(
                    new PrintActionHandler(new PrintStream(buffer, true, StandardCharsets.UTF_8)),
                    new LogActionHandler()),
            new ObjectMapper());

    @Test
    void printShouldWriteMessage() throws Exception {
        registry.resolve("print").execute(Map.of("message", "backup done", "extra", 1));
        assertThat(buffer.toString(StandardCharsets.UTF_8)).isEqualTo("backup done" + System.lineSeparator());
    }

    @Test
    void printShouldFallBackToDefaultMessage() throws Exception {
        registry.resolve("print").execute(Map.of());
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains(PrintActionHandler.DEFAULT_MESSAGE);
    }

    @Test
    void logShouldAcceptAllLevels() {
        Action action = registry.resolve("log");
        for (String level : new String[]{"debug", "info", "warning", "ERROR", "critical", "bogus"}) {
            assertThatCode(() -> action.execute(Map.of("message", "hello", "level", level))).doesNotThrowAnyException();
        }
        assertThatCode(() -> action.execute(Map.of())).doesNotThrowAnyException();
    }
}
