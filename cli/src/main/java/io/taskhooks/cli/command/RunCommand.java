package io.taskhooks.cli.command;

import io.taskhooks.cli.config.CliConfig;
import io.taskhooks.cli.console.ConsoleDispatchListener;
import io.taskhooks.core.detect.ChangeDetector;
import io.taskhooks.core.dispatch.DispatchResult;
import io.taskhooks.core.event.EventEmitter;
import io.taskhooks.core.pipeline.HookPipeline;
import io.taskhooks.core.pipeline.PipelineResult;
import io.taskhooks.core.snapshot.SnapshotParser;
import java.util.List;
import java.util.Set;

/** {@code run}: detects work-item changes between two revisions and dispatches their events. */
public final class RunCommand implements Command {

    static final String DEFAULT_BEFORE = "HEAD~1";
    static final String DEFAULT_AFTER = "HEAD";

    @Override
    public String name() {
        return "run";
    }

    @Override
    public String synopsis() {
        return "run [--before <rev>] [--after <rev>] [--dry-run]";
    }

    @Override
    public int execute(List<String> args, CommandContext context) {
        CommandArgs parsed = CommandArgs.parse(args, Set.of("--before", "--after"), Set.of("--dry-run"));
        String before = parsed.option("--before", DEFAULT_BEFORE);
        String after = parsed.option("--after", DEFAULT_AFTER);
        boolean dryRun = parsed.flag("--dry-run");
        CliConfig config = context.config();

        HookPipeline pipeline = HookPipeline.builder()
                .store(context.workItemStore())
                .registrySource(context::loadRegistry)
                .parser(new SnapshotParser(config.trackedPrefix()))
                .detector(new ChangeDetector(config.terminalStatus()))
                .emitter(new EventEmitter(context.projectRoot().toString()))
                .executor(context.executor())
                .auditSink(context.auditLog())
                .metrics(context.metricsService())
                .listener(new ConsoleDispatchListener(context.out()))
                .build();

        PipelineResult result = pipeline.run(before, after, dryRun);
        switch (result.outcome()) {
            case NO_CHANGES -> context.out().println("No tracked work-item changes between " + before + " and " + after);
            case CONFIGURATION_ERROR -> context.err().println("Configuration error: " + result.message());
            case BLOCKED -> context.err().println(result.message());
            case COMPLETED -> {
                if (dryRun) {
                    printDryRun(result, context);
                } else {
                    context.out().printf("%d event(s) dispatched%n", result.events().size());
                }
            }
        }
        return result.exitCode();
    }

    private static void printDryRun(PipelineResult result, CommandContext context) {
        for (DispatchResult dispatch : result.dispatchResults()) {
            context.out().printf(
                    "%s %s: %s%n",
                    dispatch.event().eventType(),
                    dispatch.event().contextValue("task_id"),
                    dispatch.matchedHooks().isEmpty() ? "no hooks" : "would run " + String.join(", ", dispatch.matchedHooks()));
        }
    }
}
