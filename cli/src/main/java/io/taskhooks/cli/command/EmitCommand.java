package io.taskhooks.cli.command;

import io.taskhooks.cli.console.ConsoleDispatchListener;
import io.taskhooks.core.dispatch.DispatchResult;
import io.taskhooks.core.dispatch.Dispatcher;
import io.taskhooks.core.event.EventFactory;
import io.taskhooks.core.hook.HookRegistry;
import io.taskhooks.core.model.Event;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code emit}: dispatches a manually built event. Context fields come from {@code --task-id}
 * and repeated {@code --set key=value}; a value containing commas becomes a list.
 */
public final class EmitCommand implements Command {

    private static final Logger LOG = LoggerFactory.getLogger(EmitCommand.class);

    @Override
    public String name() {
        return "emit";
    }

    @Override
    public String synopsis() {
        return "emit <event-type> [--task-id <id>] [--set key=value]... [--dry-run]";
    }

    @Override
    public int execute(List<String> args, CommandContext context) {
        CommandArgs parsed = CommandArgs.parse(args, Set.of("--task-id", "--set"), Set.of("--dry-run"));
        String eventType = parsed.requirePositional(0, "event-type");
        if (!EventFactory.isValidType(eventType)) {
            throw new UsageException("Invalid event type '" + eventType + "': expected <domain>.<action>");
        }
        boolean dryRun = parsed.flag("--dry-run");

        Map<String, Object> eventContext = new LinkedHashMap<>();
        String taskId = parsed.option("--task-id", null);
        if (taskId != null) {
            eventContext.put("task_id", taskId);
        }
        for (String assignment : parsed.options("--set")) {
            int eq = assignment.indexOf('=');
            if (eq <= 0) {
                throw new UsageException("--set expects key=value, got: " + assignment);
            }
            eventContext.put(assignment.substring(0, eq).trim(), contextValue(assignment.substring(eq + 1)));
        }

        HookRegistry registry = context.loadRegistry();
        Event event = context.eventFactory().create(eventType, eventContext);
        Dispatcher dispatcher = new Dispatcher(
                registry, context.executor(), context.auditLog(), new ConsoleDispatchListener(context.out()));
        DispatchResult result = dispatcher.dispatch(event, dryRun);

        switch (result.outcome()) {
            case NO_MATCH -> context.out().println("No hooks matched " + eventType);
            case DRY_RUN -> context.out().println("Would run: " + String.join(", ", result.matchedHooks()));
            case BLOCKED -> context.err().println(result.message());
            case COMPLETED -> context.out().printf(
                    "Event %s dispatched to %d hook(s)%n", event.eventId(), result.executions().size());
        }

        if (!dryRun && !result.executions().isEmpty()) {
            try {
                context.metricsService().refresh();
            } catch (RuntimeException e) {
                LOG.warn("Metrics refresh failed: {}", e.getMessage(), e);
            }
        }
        return result.isBlocked() ? ExitCodes.BLOCKED : ExitCodes.OK;
    }

    static Object contextValue(String raw) {
        if (!raw.contains(",")) {
            return raw;
        }
        List<String> values = new ArrayList<>();
        for (String part : raw.split(",")) {
            if (!part.isBlank()) {
                values.add(part.trim());
            }
        }
        return values;
    }
}
