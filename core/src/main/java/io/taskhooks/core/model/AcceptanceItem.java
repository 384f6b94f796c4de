package io.taskhooks.core.model;

import java.util.Objects;

/**
 * One acceptance criterion of a work item.
 *
 * @param index   1-based position (or the explicit {@code #N} marker) within the document
 * @param text    criterion text without the checkbox marker
 * @param checked whether the checkbox is ticked
 */
public record AcceptanceItem(int index, String text, boolean checked) {

    public AcceptanceItem {
        Objects.requireNonNull(text, "text must not be null");
        if (index < 1) {
            throw new IllegalArgumentException("index must be >= 1, got: " + index);
        }
    }
}
