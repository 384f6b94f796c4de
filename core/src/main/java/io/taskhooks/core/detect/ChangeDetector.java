package io.taskhooks.core.detect;

import io.taskhooks.core.model.Delta;
import io.taskhooks.core.model.Snapshot;
import io.taskhooks.core.snapshot.SnapshotSet;
import io.taskhooks.core.snapshot.TaskIdGrammar;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes semantic deltas between the work items of two revisions.
 *
 * <p>
 * Rules per identifier:
 * <ul>
 * <li>only in "after": one {@code CREATED}
 * <li>in both, status differs: one {@code STATUS_CHANGED}, flagged completed when the new status
 * is the terminal status
 * <li>in both, checked acceptance count rises or falls: one {@code AC_CHECKED} or
 * {@code AC_UNCHECKED}; an unchanged count yields nothing
 * <li>only in "before" (deleted or renamed away): nothing
 * </ul>
 * Status and acceptance changes on the same item are reported independently. Results are ordered
 * by ascending identifier ({@link TaskIdGrammar#ORDER}) and, within one identifier, in the order
 * above.
 *
 * <p>
 * Deterministic: the same pair of sets always yields the same deltas, which makes replaying a
 * revision pair idempotent. Thread-safe.
 */
public final class ChangeDetector {

    private static final Logger LOG = LoggerFactory.getLogger(ChangeDetector.class);

    public static final String DEFAULT_TERMINAL_STATUS = "Done";

    private final String terminalStatus;

    public ChangeDetector() {
        this(DEFAULT_TERMINAL_STATUS);
    }

    public ChangeDetector(String terminalStatus) {
        this.terminalStatus = Objects.requireNonNull(terminalStatus, "terminalStatus must not be null");
    }

    public String terminalStatus() {
        return terminalStatus;
    }

    public DetectionResult detect(SnapshotSet before, SnapshotSet after) {
        Objects.requireNonNull(before, "before must not be null");
        Objects.requireNonNull(after, "after must not be null");

        TreeSet<String> ids = new TreeSet<>(TaskIdGrammar.ORDER);
        ids.addAll(before.ids());
        ids.addAll(after.ids());

        List<Delta> deltas = new ArrayList<>();
        for (String id : ids) {
            Snapshot previous = before.get(id).orElse(null);
            Snapshot current = after.get(id).orElse(null);
            if (current == null) {
                LOG.debug("Work item '{}' no longer present, no event", id);
                continue;
            }
            if (previous == null) {
                deltas.add(Delta.created(current));
                continue;
            }
            if (!previous.status().equals(current.status())) {
                deltas.add(Delta.statusChanged(previous, current, terminalStatus));
            }
            if (previous.checkedCount() != current.checkedCount()) {
                deltas.add(Delta.acceptanceChanged(previous, current));
            }
        }

        DetectionResult result = new DetectionResult(deltas);
        if (result.noChanges()) {
            LOG.info("No tracked work-item changes detected");
        } else {
            LOG.debug("Detected {} delta(s) across {} work item(s)", result.size(), ids.size());
        }
        return result;
    }
}
