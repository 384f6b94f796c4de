package io.taskhooks.core.audit;

import io.taskhooks.core.model.ExecutionStatus;
import io.taskhooks.core.model.HookExecutionRecord;
import java.time.Instant;

/**
 * Filter for {@link AuditLogReader#query}. Null fields do not filter.
 *
 * @param hookName  exact hook name
 * @param eventType exact event type
 * @param status    execution status
 * @param since     inclusive lower bound on the record timestamp
 * @param tail      keep only the last N matching records; 0 keeps all
 */
public record AuditQuery(String hookName, String eventType, ExecutionStatus status, Instant since, int tail) {

    public AuditQuery {
        if (tail < 0) {
            throw new IllegalArgumentException("tail must be >= 0, got: " + tail);
        }
    }

    public static AuditQuery all() {
        return new AuditQuery(null, null, null, null, 0);
    }

    public static AuditQuery tail(int count) {
        return new AuditQuery(null, null, null, null, count);
    }

    boolean matches(HookExecutionRecord record) {
        if (hookName != null && !hookName.equals(record.hook().name())) {
            return false;
        }
        if (eventType != null && !eventType.equals(record.event().type())) {
            return false;
        }
        if (status != null && status != record.status()) {
            return false;
        }
        return since == null || !record.timestamp().isBefore(since);
    }
}
