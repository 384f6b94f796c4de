package io.taskhooks.core.event;

import io.taskhooks.core.model.Event;
import io.taskhooks.core.model.ToolInfo;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Builds ad-hoc events for manual emission and hook testing, outside the revision pipeline.
 * Unlike {@link EventEmitter}, ids are random and timestamps come from the clock.
 */
public final class EventFactory {

    private static final Pattern TYPE = Pattern.compile("^[a-z][a-z_]*\\.[a-z][a-z_]*$");

    private final String projectRoot;
    private final Clock clock;

    public EventFactory(String projectRoot, Clock clock) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public static boolean isValidType(String eventType) {
        return eventType != null && TYPE.matcher(eventType).matches();
    }

    /**
     * Creates an event with the given type and context.
     *
     * @throws IllegalArgumentException if the type is not {@code <domain>.<action>}
     */
    public Event create(String eventType, Map<String, Object> context) {
        if (!isValidType(eventType)) {
            throw new IllegalArgumentException("Invalid event type '" + eventType
                    + "': expected <domain>.<action> in lower case, e.g. task.completed");
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tool", ToolInfo.NAME);
        metadata.put("tool_version", ToolInfo.version());
        metadata.put("java_version", System.getProperty("java.version"));
        metadata.put("source", "manual");
        return new Event(
                Event.SCHEMA_VERSION,
                eventType,
                EventEmitter.ID_PREFIX + UUID.randomUUID(),
                clock.instant(),
                projectRoot,
                context,
                metadata);
    }

    /**
     * Creates a representative event for exercising one hook, with a placeholder work item and
     * plausible context fields for the type.
     */
    public Event mock(String eventType, String taskId) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("task_id", taskId != null ? taskId : "task-0");
        context.put("title", "Test task");
        context.put("labels", List.of());
        switch (eventType) {
            case "task.status_changed" -> {
                context.put("old_status", "To Do");
                context.put("new_status", "In Progress");
            }
            case "task.completed" -> {
                context.put("old_status", "In Progress");
                context.put("status", "Done");
            }
            case "task.ac_checked" -> {
                context.put("status", "In Progress");
                context.put("checked_delta", 1);
                context.put("ac_checked", 2);
                context.put("ac_total", 3);
            }
            case "task.ac_unchecked" -> {
                context.put("status", "In Progress");
                context.put("checked_delta", -1);
                context.put("ac_checked", 1);
                context.put("ac_total", 3);
            }
            default -> context.put("status", "To Do");
        }
        return create(eventType, context);
    }
}
