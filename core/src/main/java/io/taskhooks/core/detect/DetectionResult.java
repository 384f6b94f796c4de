package io.taskhooks.core.detect;

import io.taskhooks.core.model.Delta;
import java.util.List;

/**
 * Ordered deltas between two revisions. An empty result is a successful no-op, distinct from a
 * detection failure (which is thrown).
 */
public record DetectionResult(List<Delta> deltas) {

    public DetectionResult {
        deltas = deltas != null ? List.copyOf(deltas) : List.of();
    }

    public boolean noChanges() {
        return deltas.isEmpty();
    }

    public int size() {
        return deltas.size();
    }
}
