package io.taskhooks.core.snapshot;

import io.taskhooks.core.model.Snapshot;
import java.util.Objects;

/**
 * Result of parsing one document. A sealed hierarchy: a document is either a tracked work item
 * ({@link Parsed}), not a tracked work item at all ({@link Skipped}), or a tracked work item whose
 * content could not be read ({@link Failed}).
 */
public sealed interface ParseOutcome {

    String path();

    record Parsed(Snapshot snapshot) implements ParseOutcome {
        public Parsed {
            Objects.requireNonNull(snapshot, "snapshot must not be null");
        }

        @Override
        public String path() {
            return snapshot.path();
        }
    }

    record Skipped(String path, String reason) implements ParseOutcome {
        public Skipped {
            Objects.requireNonNull(path, "path must not be null");
        }
    }

    record Failed(String path, String reason) implements ParseOutcome {
        public Failed {
            Objects.requireNonNull(path, "path must not be null");
        }
    }
}
