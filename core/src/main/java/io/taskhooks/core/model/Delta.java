package io.taskhooks.core.model;

import java.util.Objects;

/**
 * A single detected change for one work item.
 *
 * <p>
 * A status transition and an acceptance-criteria change on the same item in the same revision
 * are two independent deltas, never one merged record.
 *
 * @param kind         what changed
 * @param taskId       the work-item identifier
 * @param from         previous value (status, or checked count for AC deltas), null for
 *                     {@link DeltaKind#CREATED}
 * @param to           new value (status, or checked count for AC deltas)
 * @param checkedDelta {@code after_checked - before_checked} for AC deltas, 0 otherwise
 * @param completed    true for a status change whose target is the terminal status
 * @param before       the snapshot at the "before" revision, null for CREATED
 * @param after        the snapshot at the "after" revision
 */
public record Delta(
        DeltaKind kind,
        String taskId,
        String from,
        String to,
        int checkedDelta,
        boolean completed,
        Snapshot before,
        Snapshot after) {

    public Delta {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(taskId, "taskId must not be null");
        Objects.requireNonNull(after, "after snapshot must not be null");
        if (kind != DeltaKind.CREATED) {
            Objects.requireNonNull(before, "before snapshot must not be null for " + kind);
        }
    }

    public static Delta created(Snapshot after) {
        return new Delta(DeltaKind.CREATED, after.id(), null, after.status(), 0, false, null, after);
    }

    public static Delta statusChanged(Snapshot before, Snapshot after, String terminalStatus) {
        boolean completed = terminalStatus != null && terminalStatus.equals(after.status());
        return new Delta(
                DeltaKind.STATUS_CHANGED, after.id(), before.status(), after.status(), 0, completed, before, after);
    }

    /**
     * Creates an AC delta from the checked counts of both snapshots. The kind follows the sign of
     * the difference; callers must not invoke this for a zero difference.
     */
    public static Delta acceptanceChanged(Snapshot before, Snapshot after) {
        int delta = after.checkedCount() - before.checkedCount();
        if (delta == 0) {
            throw new IllegalArgumentException("checked count unchanged for " + after.id());
        }
        DeltaKind kind = delta > 0 ? DeltaKind.AC_CHECKED : DeltaKind.AC_UNCHECKED;
        return new Delta(
                kind,
                after.id(),
                String.valueOf(before.checkedCount()),
                String.valueOf(after.checkedCount()),
                delta,
                false,
                before,
                after);
    }
}
