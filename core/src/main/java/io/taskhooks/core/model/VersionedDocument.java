package io.taskhooks.core.model;

import java.util.Objects;

/**
 * Raw document content as stored at a revision.
 *
 * @param path    store-relative path (forward slashes)
 * @param content UTF-8 text content
 */
public record VersionedDocument(String path, String content) {

    public VersionedDocument {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /** The last path segment. */
    public String fileName() {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
