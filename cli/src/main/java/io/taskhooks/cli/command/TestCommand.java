package io.taskhooks.cli.command;

import io.taskhooks.core.exec.HookExecution;
import io.taskhooks.core.hook.HookRegistry;
import io.taskhooks.core.model.Event;
import io.taskhooks.core.model.HookDefinition;
import io.taskhooks.core.model.HookExecutionRecord;
import java.util.List;
import java.util.Set;

/**
 * {@code test}: runs one hook against a mock event and prints its output. The execution is not
 * written to the audit log.
 */
public final class TestCommand implements Command {

    @Override
    public String name() {
        return "test";
    }

    @Override
    public String synopsis() {
        return "test <hook-name> <event-type> [--task-id <id>]";
    }

    @Override
    public int execute(List<String> args, CommandContext context) {
        CommandArgs parsed = CommandArgs.parse(args, Set.of("--task-id"), Set.of());
        String hookName = parsed.requirePositional(0, "hook-name");
        String eventType = parsed.requirePositional(1, "event-type");

        HookRegistry registry = context.loadRegistry();
        HookDefinition hook = registry.find(hookName).orElse(null);
        if (hook == null) {
            context.err().println("Unknown hook: " + hookName);
            return ExitCodes.FAILURE;
        }
        Event event;
        try {
            event = context.eventFactory().mock(eventType, parsed.option("--task-id", null));
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
        if (!hook.matches(event)) {
            context.out().printf("Note: %s would not match %s; running anyway%n", hookName, eventType);
        }

        HookExecution execution = context.executor().execute(hook, event);
        HookExecutionRecord record = execution.record();
        context.out().printf(
                "%s: %s (exit %s, %d ms)%n",
                hookName,
                record.status().wireName(),
                record.execution().exitCode() != null ? record.execution().exitCode() : "-",
                record.execution().durationMs());
        if (record.error() != null) {
            context.out().println("error: " + record.error());
        }
        for (String warning : record.security().warnings()) {
            context.out().println("warning: " + warning);
        }
        if (!execution.stdout().isEmpty()) {
            context.out().println("--- stdout ---");
            context.out().print(withTrailingNewline(execution.stdout()));
        }
        if (!execution.stderr().isEmpty()) {
            context.out().println("--- stderr ---");
            context.out().print(withTrailingNewline(execution.stderr()));
        }
        return execution.succeeded() ? ExitCodes.OK : ExitCodes.FAILURE;
    }

    private static String withTrailingNewline(String text) {
        return text.endsWith("\n") ? text : text + "\n";
    }
}
