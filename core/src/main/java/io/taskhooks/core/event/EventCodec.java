package io.taskhooks.core.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.taskhooks.core.model.Event;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON wire form of {@link Event}, the payload handed to hooks on stdin and in
 * {@code HOOK_EVENT_FILE}.
 *
 * <pre>
 * {"schema_version":"1.0","event_type":"task.completed","event_id":"evt_...",
 *  "timestamp":"2026-01-05T10:00:00Z","project_root":"/repo","context":{...},"metadata":{...}}
 * </pre>
 */
public final class EventCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper mapper;

    public EventCodec() {
        this(new ObjectMapper());
    }

    public EventCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode toNode(Event event) {
        ObjectNode node = mapper.createObjectNode();
        node.put("schema_version", event.schemaVersion());
        node.put("event_type", event.eventType());
        node.put("event_id", event.eventId());
        node.put("timestamp", event.timestamp().toString());
        if (event.projectRoot() != null) {
            node.put("project_root", event.projectRoot());
        }
        node.set("context", mapper.valueToTree(event.context()));
        node.set("metadata", mapper.valueToTree(event.metadata()));
        return node;
    }

    public String toJson(Event event) {
        try {
            return mapper.writeValueAsString(toNode(event));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize event " + event.eventId(), e);
        }
    }

    /**
     * Reads an event back from JSON.
     *
     * @throws IllegalArgumentException if the JSON is malformed or lacks a required field
     */
    public Event fromJson(String json) {
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed event JSON: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Event JSON must be an object");
        }
        try {
            return new Event(
                    required(node, "schema_version"),
                    required(node, "event_type"),
                    required(node, "event_id"),
                    Instant.parse(required(node, "timestamp")),
                    node.hasNonNull("project_root") ? node.get("project_root").asText() : null,
                    toMap(node.get("context")),
                    toMap(node.get("metadata")));
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid event timestamp: " + e.getParsedString(), e);
        }
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        return mapper.convertValue(node, MAP_TYPE);
    }

    private static String required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.asText().isEmpty()) {
            throw new IllegalArgumentException("Event JSON is missing required field '" + field + "'");
        }
        return value.asText();
    }
}
