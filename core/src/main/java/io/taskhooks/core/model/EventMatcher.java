package io.taskhooks.core.model;

import java.util.Objects;

/**
 * One {@code events[]} entry of a hook: an event-type pattern plus an optional context filter.
 */
public record EventMatcher(EventPattern pattern, ContextFilter filter) {

    public EventMatcher {
        Objects.requireNonNull(pattern, "pattern must not be null");
        filter = filter != null ? filter : ContextFilter.empty();
    }

    public static EventMatcher of(String pattern) {
        return new EventMatcher(EventPattern.parse(pattern), ContextFilter.empty());
    }

    public boolean matches(Event event) {
        return pattern.matches(event.eventType()) && filter.matches(event.context());
    }
}
