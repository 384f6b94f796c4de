package io.taskhooks.core.error;

import java.util.List;

/**
 * Thrown when the hooks configuration is unreadable, malformed or fails schema validation. A
 * configuration error disables hook execution for the whole run.
 */
public final class ConfigurationException extends HookLoadException {

    private static final long serialVersionUID = 1L;

    private final List<String> errors;

    public ConfigurationException(String message, String source) {
        this(message, List.of(), source);
    }

    public ConfigurationException(String message, List<String> errors, String source) {
        super(format(message, errors), null, source);
        this.errors = List.copyOf(errors);
    }

    public ConfigurationException(String message, Throwable cause, String source) {
        super(message, cause, null, source);
        this.errors = List.of();
    }

    /** Individual validation errors, empty when the failure is a single read/parse error. */
    public List<String> errors() {
        return errors;
    }

    private static String format(String message, List<String> errors) {
        if (errors == null || errors.isEmpty()) {
            return message;
        }
        return message + ":\n  - " + String.join("\n  - ", errors);
    }
}
