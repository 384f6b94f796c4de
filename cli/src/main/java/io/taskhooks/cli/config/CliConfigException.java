package io.taskhooks.cli.config;

/**
 * Thrown when CLI configuration loading fails: an explicitly named file is missing, the YAML is
 * invalid, or a value has the wrong type. The message is suitable for direct terminal output.
 */
public class CliConfigException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public CliConfigException(String message) {
        super(message);
    }

    public CliConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
