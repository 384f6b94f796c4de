package io.taskhooks.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Conjunctive predicate over an event's context map.
 *
 * <p>
 * Every key must hold for the filter to match. Key forms:
 * <ul>
 * <li>{@code labels_any: [a, b]}: the context value (scalar or list) overlaps the expected
 * list
 * <li>{@code labels_all: [a, b]}: every expected value is present in the context value
 * <li>{@code status: [Done, Review]}: plain list, the actual value is one of them (a list actual
 * must overlap)
 * <li>{@code status: Done}: scalar equality
 * </ul>
 * A missing context field never matches. Values are compared by their string form, so
 * {@code ac_checked: 3} in YAML matches the integer 3 in the event.
 *
 * @param criteria expected values keyed by context field (with optional suffix)
 */
public record ContextFilter(Map<String, Object> criteria) {

    static final String ANY_SUFFIX = "_any";
    static final String ALL_SUFFIX = "_all";

    private static final ContextFilter EMPTY = new ContextFilter(Map.of());

    public ContextFilter {
        criteria = criteria == null || criteria.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(criteria));
    }

    /** A filter that matches every event. */
    public static ContextFilter empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return criteria.isEmpty();
    }

    /** Returns {@code true} if every criterion holds against the given context. */
    public boolean matches(Map<String, Object> context) {
        for (Map.Entry<String, Object> criterion : criteria.entrySet()) {
            if (!criterionHolds(criterion.getKey(), criterion.getValue(), context)) {
                return false;
            }
        }
        return true;
    }

    private static boolean criterionHolds(String key, Object expected, Map<String, Object> context) {
        if (key.endsWith(ANY_SUFFIX) && !context.containsKey(key)) {
            Object actual = context.get(key.substring(0, key.length() - ANY_SUFFIX.length()));
            return actual != null && overlaps(asList(actual), asList(expected));
        }
        if (key.endsWith(ALL_SUFFIX) && !context.containsKey(key)) {
            Object actual = context.get(key.substring(0, key.length() - ALL_SUFFIX.length()));
            return actual != null && containsAll(asList(actual), asList(expected));
        }
        Object actual = context.get(key);
        if (actual == null) {
            return false;
        }
        if (expected instanceof Collection<?>) {
            return overlaps(asList(actual), asList(expected));
        }
        if (actual instanceof Collection<?>) {
            return false;
        }
        return String.valueOf(actual).equals(String.valueOf(expected));
    }

    private static boolean overlaps(List<String> actual, List<String> expected) {
        for (String value : expected) {
            if (actual.contains(value)) {
                return true;
            }
        }
        return false;
    }

    private static boolean containsAll(List<String> actual, List<String> expected) {
        return actual.containsAll(expected);
    }

    private static List<String> asList(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection.stream().map(String::valueOf).toList();
        }
        return List.of(String.valueOf(Objects.requireNonNull(value)));
    }
}
