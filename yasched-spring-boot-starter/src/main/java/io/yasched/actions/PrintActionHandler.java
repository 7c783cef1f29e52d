package io.yasched.actions;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.yasched.ActionHandler;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Built-in "print" action: writes {@code message} to standard output.
 */
public class PrintActionHandler implements ActionHandler<PrintActionHandler.Parameters> {

    public static final String DEFAULT_MESSAGE = "Hello from yasched!";

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Parameters(String message) {
    }

    private final PrintStream out;

    public PrintActionHandler() {
        this(System.out);
    }

    public PrintActionHandler(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String name() {
        return "print";
    }

    @Override
    public Class<Parameters> parameterClass() {
        return Parameters.class;
    }

    @Override
    public void execute(Parameters parameters) {
        String message = parameters == null || parameters.message() == null ? DEFAULT_MESSAGE : parameters.message();
        out.println(message);
    }
}
