package io.taskhooks.core.audit;

import io.taskhooks.core.model.HookExecutionRecord;

/**
 * Destination for hook execution records. Implementations must persist the record before
 * {@link #append} returns and must never modify or drop earlier records.
 */
public interface AuditSink {

    /**
     * Appends one finalized record.
     *
     * @throws io.taskhooks.core.error.AuditWriteException if the record cannot be persisted
     */
    void append(HookExecutionRecord record);
}
