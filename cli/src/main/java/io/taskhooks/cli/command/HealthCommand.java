package io.taskhooks.cli.command;

import io.taskhooks.core.metrics.HealthCheck;
import io.taskhooks.core.metrics.HealthReport;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** {@code health}: evaluates the current metrics window. Exits 1 when unhealthy. */
public final class HealthCommand implements Command {

    @Override
    public String name() {
        return "health";
    }

    @Override
    public String synopsis() {
        return "health [--min-success-rate r] [--near-timeout-ratio r]";
    }

    @Override
    public int execute(List<String> args, CommandContext context) {
        CommandArgs parsed =
                CommandArgs.parse(args, Set.of("--min-success-rate", "--near-timeout-ratio"), Set.of());
        HealthCheck check;
        try {
            check = new HealthCheck(
                    parsed.doubleOption("--min-success-rate", context.config().minSuccessRate()),
                    parsed.doubleOption("--near-timeout-ratio", context.config().nearTimeoutRatio()));
        } catch (IllegalArgumentException e) {
            throw new UsageException(e.getMessage());
        }
        HealthReport report = check.evaluate(context.metricsService().current());

        context.out().println("Status: " + report.status());
        for (Map.Entry<String, HealthReport.HealthStatus> entry : report.perHook().entrySet()) {
            context.out().printf("  %-24s %s%n", entry.getKey(), entry.getValue());
        }
        report.warnings().forEach(w -> context.out().println("  WARN: " + w));
        return report.status() == HealthReport.HealthStatus.UNHEALTHY ? ExitCodes.FAILURE : ExitCodes.OK;
    }
}
