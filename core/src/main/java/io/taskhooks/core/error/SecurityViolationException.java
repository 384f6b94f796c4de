package io.taskhooks.core.error;

/**
 * Thrown when a hook's action, working directory or environment violates the sandbox contract.
 * Raised before any process is spawned; the executor converts it into a
 * {@code security.violation} audit record.
 */
public final class SecurityViolationException extends HookException {

    private static final long serialVersionUID = 1L;

    private final String offendingValue;

    public SecurityViolationException(String message, String hookName, String offendingValue) {
        super(message, hookName, Phase.EXECUTION);
        this.offendingValue = offendingValue;
    }

    /** The path, directory or env value that was rejected. */
    public String offendingValue() {
        return offendingValue;
    }
}
