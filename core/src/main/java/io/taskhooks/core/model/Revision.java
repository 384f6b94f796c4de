package io.taskhooks.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A resolved revision of the work-item store.
 *
 * @param id         stable revision identifier (e.g. a commit hash), or {@link #EMPTY_ID}
 * @param committedAt commit time; used as the timestamp of events derived from it
 */
public record Revision(String id, Instant committedAt) {

    /** Identifier of the empty revision (e.g. the parent of the first commit). */
    public static final String EMPTY_ID = "empty";

    public Revision {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(committedAt, "committedAt must not be null");
    }

    /** A revision with no documents. */
    public static Revision empty() {
        return new Revision(EMPTY_ID, Instant.EPOCH);
    }

    public boolean isEmpty() {
        return EMPTY_ID.equals(id);
    }
}
