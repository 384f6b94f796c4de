package io.taskhooks.core.error;

/**
 * Abstract parent for load-time errors. Carries an additional {@code source} field identifying
 * the file or revision that caused the error.
 */
public abstract class HookLoadException extends HookException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected HookLoadException(String message, String hookName, String source) {
        super(message, hookName, Phase.LOAD);
        this.source = source;
    }

    protected HookLoadException(String message, Throwable cause, String hookName, String source) {
        super(message, cause, hookName, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
