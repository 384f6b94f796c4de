package io.taskhooks.core.event;

import io.taskhooks.core.model.Delta;
import io.taskhooks.core.model.Event;
import io.taskhooks.core.model.EventType;
import io.taskhooks.core.model.Revision;
import io.taskhooks.core.model.Snapshot;
import io.taskhooks.core.model.ToolInfo;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps deltas to canonical events.
 *
 * <p>
 * A pure function of the revision pair and the deltas: event ids are name-based UUIDs over
 * {@code before|after|taskId|eventType} and timestamps are the "after" revision's commit time, so
 * re-emitting the same pair yields identical events. A status change into the terminal status
 * produces {@code task.status_changed} immediately followed by {@code task.completed}.
 */
public final class EventEmitter {

    private static final Logger LOG = LoggerFactory.getLogger(EventEmitter.class);

    static final String ID_PREFIX = "evt_";

    private final String projectRoot;

    public EventEmitter(String projectRoot) {
        this.projectRoot = Objects.requireNonNull(projectRoot, "projectRoot must not be null");
    }

    public List<Event> emit(List<Delta> deltas, Revision before, Revision after) {
        Objects.requireNonNull(before, "before must not be null");
        Objects.requireNonNull(after, "after must not be null");
        List<Event> events = new ArrayList<>();
        for (Delta delta : deltas) {
            switch (delta.kind()) {
                case CREATED -> events.add(event(EventType.TASK_CREATED, createdContext(delta), before, after, delta));
                case STATUS_CHANGED -> {
                    events.add(event(EventType.TASK_STATUS_CHANGED, statusContext(delta), before, after, delta));
                    if (delta.completed()) {
                        events.add(event(EventType.TASK_COMPLETED, completedContext(delta), before, after, delta));
                    }
                }
                case AC_CHECKED -> events.add(event(EventType.TASK_AC_CHECKED, acContext(delta), before, after, delta));
                case AC_UNCHECKED -> events.add(
                        event(EventType.TASK_AC_UNCHECKED, acContext(delta), before, after, delta));
            }
        }
        LOG.debug("Emitted {} event(s) from {} delta(s)", events.size(), deltas.size());
        return events;
    }

    private Event event(
            EventType type, Map<String, Object> context, Revision before, Revision after, Delta delta) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("tool", ToolInfo.NAME);
        metadata.put("tool_version", ToolInfo.version());
        metadata.put("java_version", System.getProperty("java.version"));
        metadata.put("before_revision", before.id());
        metadata.put("after_revision", after.id());
        return new Event(
                Event.SCHEMA_VERSION,
                type.value(),
                eventId(before, after, delta.taskId(), type.value()),
                after.committedAt(),
                projectRoot,
                context,
                metadata);
    }

    static String eventId(Revision before, Revision after, String taskId, String eventType) {
        String name = before.id() + "|" + after.id() + "|" + taskId + "|" + eventType;
        return ID_PREFIX + UUID.nameUUIDFromBytes(name.getBytes(StandardCharsets.UTF_8));
    }

    private static Map<String, Object> createdContext(Delta delta) {
        Snapshot after = delta.after();
        Map<String, Object> context = base(after);
        context.put("status", after.status());
        context.put("ac_checked", after.checkedCount());
        context.put("ac_total", after.totalCount());
        return context;
    }

    private static Map<String, Object> statusContext(Delta delta) {
        Map<String, Object> context = base(delta.after());
        context.put("old_status", delta.from());
        context.put("new_status", delta.to());
        return context;
    }

    private static Map<String, Object> completedContext(Delta delta) {
        Snapshot after = delta.after();
        Map<String, Object> context = base(after);
        context.put("status", after.status());
        context.put("old_status", delta.from());
        context.put("ac_checked", after.checkedCount());
        context.put("ac_total", after.totalCount());
        return context;
    }

    private static Map<String, Object> acContext(Delta delta) {
        Snapshot after = delta.after();
        Map<String, Object> context = base(after);
        context.put("status", after.status());
        context.put("checked_delta", delta.checkedDelta());
        context.put("previous_checked", delta.before().checkedCount());
        context.put("ac_checked", after.checkedCount());
        context.put("ac_total", after.totalCount());
        return context;
    }

    private static Map<String, Object> base(Snapshot snapshot) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("task_id", snapshot.id());
        if (snapshot.title() != null) {
            context.put("title", snapshot.title());
        }
        if (snapshot.priority() != null) {
            context.put("priority", snapshot.priority());
        }
        context.put("labels", List.copyOf(snapshot.labels()));
        context.put("path", snapshot.path());
        return context;
    }
}
