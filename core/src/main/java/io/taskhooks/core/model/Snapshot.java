package io.taskhooks.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Point-in-time view of one tracked work item at a revision.
 *
 * <p>
 * Immutable. Created by {@code SnapshotParser}; never partially populated: a document whose
 * identifier or status cannot be read produces no snapshot at all.
 *
 * @param id              strict work-item identifier (e.g. {@code task-12} or {@code task-12.3})
 * @param path            repository-relative path of the source document
 * @param title           human-readable title, or null when the document has none
 * @param status          workflow status (e.g. "To Do", "In Progress", "Done")
 * @param priority        priority label, or null
 * @param labels          labels in declaration order
 * @param acceptanceItems acceptance criteria in document order
 */
public record Snapshot(
        String id,
        String path,
        String title,
        String status,
        String priority,
        Set<String> labels,
        List<AcceptanceItem> acceptanceItems) {

    public Snapshot {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(status, "status must not be null");
        labels = labels != null ? Collections.unmodifiableSet(new LinkedHashSet<>(labels)) : Set.of();
        acceptanceItems = acceptanceItems != null ? List.copyOf(acceptanceItems) : List.of();
    }

    /** Number of ticked acceptance criteria. */
    public int checkedCount() {
        int count = 0;
        for (AcceptanceItem item : acceptanceItems) {
            if (item.checked()) count++;
        }
        return count;
    }

    /** Total number of acceptance criteria. */
    public int totalCount() {
        return acceptanceItems.size();
    }
}
