package io.taskhooks.core.error;

/**
 * Abstract base for all taskhooks exceptions. Never thrown directly; use the concrete
 * subclasses under {@link HookLoadException} or {@link SecurityViolationException}.
 */
public abstract class HookException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        EXECUTION
    }

    private final String hookName;
    private final Phase phase;

    protected HookException(String message, String hookName, Phase phase) {
        super(message);
        this.hookName = hookName;
        this.phase = phase;
    }

    protected HookException(String message, Throwable cause, String hookName, Phase phase) {
        super(message, cause);
        this.hookName = hookName;
        this.phase = phase;
    }

    /** The hook that triggered the error, or {@code null} if not tied to a single hook. */
    public String hookName() {
        return hookName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
