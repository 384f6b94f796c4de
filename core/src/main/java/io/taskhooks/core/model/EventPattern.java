package io.taskhooks.core.model;

import java.util.Objects;

/**
 * Value object representing an event-type match pattern used by hook matchers.
 *
 * <p>
 * Implementations are a sealed hierarchy. Patterns operate on dot-delimited event types
 * ({@code task.completed}):
 * <ul>
 * <li>{@code task.completed}: {@link Exact}
 * <li>{@code task.*}: {@link LastSegmentWildcard}, the prefix followed by exactly one more
 * segment
 * <li>{@code *.completed}: {@link PrefixWildcard}, any single leading segment with that suffix
 * <li>{@code *}: {@link Any}
 * </ul>
 *
 * <p>
 * Thread-safe and immutable.
 */
public sealed interface EventPattern {

    /** Returns {@code true} if the given event type matches this pattern. */
    boolean matches(String eventType);

    /** The pattern as written in configuration. */
    String expression();

    /**
     * Parses a pattern expression.
     *
     * @throws IllegalArgumentException if the expression is blank or uses a wildcard anywhere
     *                                  other than a whole first or last segment
     */
    static EventPattern parse(String expression) {
        Objects.requireNonNull(expression, "pattern must not be null");
        String trimmed = expression.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Event pattern must not be blank");
        }
        if (trimmed.equals("*")) {
            return Any.INSTANCE;
        }
        if (trimmed.endsWith(".*") && trimmed.indexOf('*') == trimmed.length() - 1) {
            return new LastSegmentWildcard(trimmed.substring(0, trimmed.length() - 2));
        }
        if (trimmed.startsWith("*.") && trimmed.lastIndexOf('*') == 0) {
            return new PrefixWildcard(trimmed.substring(2));
        }
        if (trimmed.indexOf('*') >= 0) {
            throw new IllegalArgumentException("Unsupported wildcard position in event pattern '" + trimmed
                    + "': use '*', '<prefix>.*' or '*.<suffix>'");
        }
        return new Exact(trimmed);
    }

    // Implementations

    /** Matches one event type exactly. */
    record Exact(String type) implements EventPattern {
        public Exact {
            Objects.requireNonNull(type, "type must not be null");
        }

        @Override
        public boolean matches(String eventType) {
            return type.equals(eventType);
        }

        @Override
        public String expression() {
            return type;
        }
    }

    /**
     * {@code task.*}: the prefix plus exactly one additional segment. {@code task.*} matches
     * {@code task.created} but neither {@code task} nor {@code task.ac.checked}.
     */
    record LastSegmentWildcard(String prefix) implements EventPattern {
        public LastSegmentWildcard {
            Objects.requireNonNull(prefix, "prefix must not be null");
            if (prefix.isEmpty()) {
                throw new IllegalArgumentException("Wildcard prefix must not be empty");
            }
        }

        @Override
        public boolean matches(String eventType) {
            if (eventType == null || !eventType.startsWith(prefix + ".")) {
                return false;
            }
            String rest = eventType.substring(prefix.length() + 1);
            return !rest.isEmpty() && rest.indexOf('.') < 0;
        }

        @Override
        public String expression() {
            return prefix + ".*";
        }
    }

    /** {@code *.completed}: exactly one leading segment followed by the suffix. */
    record PrefixWildcard(String suffix) implements EventPattern {
        public PrefixWildcard {
            Objects.requireNonNull(suffix, "suffix must not be null");
            if (suffix.isEmpty()) {
                throw new IllegalArgumentException("Wildcard suffix must not be empty");
            }
        }

        @Override
        public boolean matches(String eventType) {
            if (eventType == null || !eventType.endsWith("." + suffix)) {
                return false;
            }
            String head = eventType.substring(0, eventType.length() - suffix.length() - 1);
            return !head.isEmpty() && head.indexOf('.') < 0;
        }

        @Override
        public String expression() {
            return "*." + suffix;
        }
    }

    /** {@code *}: every event type. */
    enum Any implements EventPattern {
        INSTANCE;

        @Override
        public boolean matches(String eventType) {
            return eventType != null;
        }

        @Override
        public String expression() {
            return "*";
        }
    }
}
