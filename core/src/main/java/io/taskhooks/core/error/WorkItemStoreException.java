package io.taskhooks.core.error;

/** Thrown when the work-item store cannot list or read documents at a revision. */
public final class WorkItemStoreException extends HookLoadException {

    private static final long serialVersionUID = 1L;

    public WorkItemStoreException(String message, String revision) {
        super(message, null, revision);
    }

    public WorkItemStoreException(String message, Throwable cause, String revision) {
        super(message, cause, null, revision);
    }
}
