package io.taskhooks.cli.command;

import io.taskhooks.core.hook.HookConfigValidator;
import io.taskhooks.core.hook.ValidationReport;
import java.util.List;
import java.util.Set;

/** {@code validate}: checks the hooks configuration without running anything. */
public final class ValidateCommand implements Command {

    @Override
    public String name() {
        return "validate";
    }

    @Override
    public String synopsis() {
        return "validate";
    }

    @Override
    public int execute(List<String> args, CommandContext context) {
        CommandArgs.parse(args, Set.of(), Set.of());
        HookConfigValidator validator = new HookConfigValidator(
                context.parser(), context.projectRoot(), context.executorSettings().hooksDirectory());
        ValidationReport report = validator.validate(context.hooksFile());

        context.out().println("Validating " + report.source());
        report.errors().forEach(e -> context.out().println("  ERROR: " + e));
        report.warnings().forEach(w -> context.out().println("  WARN:  " + w));
        if (report.valid()) {
            context.out().printf(
                    "OK: %d hook(s), %d warning(s)%n", report.hookCount(), report.warnings().size());
            return ExitCodes.OK;
        }
        context.out().printf("INVALID: %d error(s)%n", report.errors().size());
        return ExitCodes.FAILURE;
    }
}
