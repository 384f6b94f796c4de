package io.taskhooks.core.error;

/**
 * Thrown when an audit record cannot be appended. Hook outcomes must never go unrecorded, so this
 * aborts the dispatch.
 */
public final class AuditWriteException extends HookException {

    private static final long serialVersionUID = 1L;

    private final String location;

    public AuditWriteException(String message, Throwable cause, String hookName, String location) {
        super(message, cause, hookName, Phase.EXECUTION);
        this.location = location;
    }

    /** The audit log file that could not be written. */
    public String location() {
        return location;
    }
}
