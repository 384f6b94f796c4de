package io.taskhooks.core.model;

/** Kind of semantic change detected for one work item between two revisions. */
public enum DeltaKind {
    CREATED,
    STATUS_CHANGED,
    AC_CHECKED,
    AC_UNCHECKED
}
