package io.taskhooks.core.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical, versioned event payload delivered to hooks.
 *
 * <p>
 * Immutable once constructed: context and metadata maps (and any list values inside them) are
 * copied into unmodifiable structures that keep insertion order.
 *
 * @param schemaVersion payload schema version (currently {@value #SCHEMA_VERSION})
 * @param eventType     dot-delimited type, e.g. {@code task.status_changed}
 * @param eventId       unique identifier ({@code evt_} prefix)
 * @param timestamp     emission timestamp
 * @param projectRoot   absolute project root the event originates from
 * @param context       entity-scoped fields (task id, old/new values, counts)
 * @param metadata      tool and runtime information
 */
public record Event(
        String schemaVersion,
        String eventType,
        String eventId,
        Instant timestamp,
        String projectRoot,
        Map<String, Object> context,
        Map<String, Object> metadata) {

    public static final String SCHEMA_VERSION = "1.0";

    public Event {
        Objects.requireNonNull(schemaVersion, "schemaVersion must not be null");
        Objects.requireNonNull(eventType, "eventType must not be null");
        Objects.requireNonNull(eventId, "eventId must not be null");
        Objects.requireNonNull(timestamp, "timestamp must not be null");
        context = freeze(context);
        metadata = freeze(metadata);
    }

    /** Returns a context value, or null when absent. */
    public Object contextValue(String key) {
        return context.get(key);
    }

    private static Map<String, Object> freeze(Map<?, ?> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> copy.put(String.valueOf(key), freezeValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object freezeValue(Object value) {
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<>(list));
        }
        if (value instanceof Map<?, ?> map) {
            return freeze(map);
        }
        return value;
    }
}
