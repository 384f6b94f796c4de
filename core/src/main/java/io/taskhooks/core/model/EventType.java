package io.taskhooks.core.model;

import java.util.Optional;

/**
 * Canonical event types derived from work-item changes. Names follow the
 * {@code <domain>.<action>} convention with a past-tense action.
 */
public enum EventType {
    TASK_CREATED("task.created"),
    TASK_STATUS_CHANGED("task.status_changed"),
    TASK_COMPLETED("task.completed"),
    TASK_AC_CHECKED("task.ac_checked"),
    TASK_AC_UNCHECKED("task.ac_unchecked");

    private final String value;

    EventType(String value) {
        this.value = value;
    }

    /** The dot-delimited wire name (e.g. {@code task.completed}). */
    public String value() {
        return value;
    }

    /** Looks up a canonical type by its wire name. */
    public static Optional<EventType> fromValue(String value) {
        for (EventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return value;
    }
}
