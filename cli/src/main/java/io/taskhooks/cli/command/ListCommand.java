package io.taskhooks.cli.command;

import io.taskhooks.core.hook.HookRegistry;
import io.taskhooks.core.model.HookDefinition;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/** {@code list}: prints the configured hooks in declaration order. */
public final class ListCommand implements Command {

    @Override
    public String name() {
        return "list";
    }

    @Override
    public String synopsis() {
        return "list";
    }

    @Override
    public int execute(List<String> args, CommandContext context) {
        CommandArgs.parse(args, Set.of(), Set.of());
        HookRegistry registry = context.loadRegistry();
        if (registry.isEmpty()) {
            context.out().println("No hooks configured in " + context.hooksFile());
            return ExitCodes.OK;
        }
        for (HookDefinition hook : registry.hooks()) {
            String events = hook.matchers().stream()
                    .map(m -> m.pattern().expression() + (m.filter().isEmpty() ? "" : " (filtered)"))
                    .collect(Collectors.joining(", "));
            context.out().printf(
                    "%s%s%n    events:    %s%n    %-10s %s%n    timeout:   %ds, fail_mode: %s%n",
                    hook.name(),
                    hook.enabled() ? "" : " [disabled]",
                    events,
                    hook.action().type() + ":",
                    hook.action().describe(),
                    hook.timeout().toSeconds(),
                    hook.failMode().configValue());
            if (hook.description() != null) {
                context.out().println("    " + hook.description());
            }
        }
        context.out().printf("%d hook(s)%n", registry.size());
        return ExitCodes.OK;
    }
}
