package io.taskhooks.core.spi;

import io.taskhooks.core.model.Revision;
import io.taskhooks.core.model.VersionedDocument;
import java.util.List;

/**
 * Read-only access to work-item documents at specific revisions of a version-controlled store.
 *
 * <p>
 * Implementations live outside the core (e.g. a git adapter). They must be deterministic: the
 * same revision always lists the same documents.
 */
public interface WorkItemStore {

    /**
     * Resolves a revision marker (e.g. {@code HEAD}, {@code HEAD~1}, a commit hash).
     *
     * @return the resolved revision, or {@link Revision#empty()} when the marker names a
     *         revision that does not exist (such as the parent of the first commit)
     * @throws io.taskhooks.core.error.WorkItemStoreException if the store cannot be read
     */
    Revision resolve(String marker);

    /**
     * Lists the work-item documents at a revision.
     *
     * @return documents in path order; empty for {@link Revision#empty()}
     * @throws io.taskhooks.core.error.WorkItemStoreException if the store cannot be read
     */
    List<VersionedDocument> list(Revision revision);
}
