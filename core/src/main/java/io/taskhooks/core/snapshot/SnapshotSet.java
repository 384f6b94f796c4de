package io.taskhooks.core.snapshot;

import io.taskhooks.core.model.Snapshot;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * All tracked work items at one revision, keyed by identifier.
 *
 * <p>
 * Identifiers are unique: when two documents claim the same id, the one with the
 * lexicographically smaller path wins and the other is dropped with a warning. Iteration order
 * is {@link TaskIdGrammar#ORDER}.
 */
public final class SnapshotSet {

    private static final Logger LOG = LoggerFactory.getLogger(SnapshotSet.class);

    private static final SnapshotSet EMPTY = new SnapshotSet(new TreeMap<>(TaskIdGrammar.ORDER), List.of());

    private final Map<String, Snapshot> byId;
    private final List<ParseOutcome.Failed> failures;

    private SnapshotSet(TreeMap<String, Snapshot> byId, List<ParseOutcome.Failed> failures) {
        this.byId = Collections.unmodifiableMap(byId);
        this.failures = List.copyOf(failures);
    }

    public static SnapshotSet empty() {
        return EMPTY;
    }

    /** Builds a set from parse outcomes, ignoring skipped documents. */
    public static SnapshotSet of(Collection<? extends ParseOutcome> outcomes) {
        List<ParseOutcome.Parsed> parsed = new ArrayList<>();
        List<ParseOutcome.Failed> failures = new ArrayList<>();
        for (ParseOutcome outcome : outcomes) {
            if (outcome instanceof ParseOutcome.Parsed p) {
                parsed.add(p);
            } else if (outcome instanceof ParseOutcome.Failed f) {
                failures.add(f);
            }
        }
        parsed.sort(Comparator.comparing(ParseOutcome::path));

        TreeMap<String, Snapshot> byId = new TreeMap<>(TaskIdGrammar.ORDER);
        for (ParseOutcome.Parsed p : parsed) {
            Snapshot snapshot = p.snapshot();
            Snapshot existing = byId.putIfAbsent(snapshot.id(), snapshot);
            if (existing != null) {
                LOG.warn(
                        "Duplicate work item id '{}': keeping '{}', ignoring '{}'",
                        snapshot.id(),
                        existing.path(),
                        snapshot.path());
            }
        }
        return new SnapshotSet(byId, failures);
    }

    public static SnapshotSet of(Snapshot... snapshots) {
        List<ParseOutcome> outcomes = new ArrayList<>();
        for (Snapshot snapshot : snapshots) {
            outcomes.add(new ParseOutcome.Parsed(snapshot));
        }
        return of(outcomes);
    }

    public Optional<Snapshot> get(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public boolean contains(String id) {
        return byId.containsKey(id);
    }

    /** Identifiers in ascending order. */
    public Set<String> ids() {
        return byId.keySet();
    }

    public Collection<Snapshot> snapshots() {
        return byId.values();
    }

    /** Tracked documents that could not be parsed at this revision. */
    public List<ParseOutcome.Failed> failures() {
        return failures;
    }

    public int size() {
        return byId.size();
    }

    public boolean isEmpty() {
        return byId.isEmpty();
    }
}
