package io.taskhooks.cli.command;

import io.taskhooks.core.metrics.MetricsService;
import io.taskhooks.core.metrics.MetricsTrend;
import io.taskhooks.core.metrics.MetricsWindow;
import io.taskhooks.core.metrics.Stats;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@code metrics}: refreshes stored windows from the audit log, then prints the current window,
 * recent history and the per-hook trend against the previous window.
 */
public final class MetricsCommand implements Command {

    static final int DEFAULT_HISTORY = 5;

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public String synopsis() {
        return "metrics [--history N] [--rebuild]";
    }

    @Override
    public int execute(List<String> args, CommandContext context) {
        CommandArgs parsed = CommandArgs.parse(args, Set.of("--history"), Set.of("--rebuild"));
        int historyCount = parsed.intOption("--history", DEFAULT_HISTORY);
        if (historyCount < 0) {
            throw new UsageException("--history must be >= 0");
        }
        MetricsService service = context.metricsService();
        PrintStream out = context.out();

        if (parsed.flag("--rebuild")) {
            out.printf("Rebuilt %d window(s) from the audit log%n", service.rebuild().size());
        } else {
            service.refresh();
        }

        MetricsWindow current = service.current();
        out.printf("Current window %s .. %s%n", current.periodStart(), current.periodEnd());
        printStats(out, "  all hooks", current.global());
        for (Map.Entry<String, Stats> entry : current.perHook().entrySet()) {
            printStats(out, "  " + entry.getKey(), entry.getValue());
        }
        for (Map.Entry<String, Stats> entry : current.perEventType().entrySet()) {
            printStats(out, "  [" + entry.getKey() + "]", entry.getValue());
        }

        List<MetricsWindow> history = service.history(historyCount + 1);
        MetricsWindow previous = null;
        if (historyCount > 0) {
            out.println("History:");
            for (MetricsWindow window : history) {
                if (!window.periodStart().isBefore(current.periodStart())) {
                    continue;
                }
                previous = window;
                out.printf(
                        "  %s  count=%d success_rate=%.1f%% p95=%dms%n",
                        window.periodStart(),
                        window.global().count(),
                        window.global().successRate() * 100,
                        window.global().p95());
            }
        }
        if (previous != null) {
            out.println("Trend vs " + previous.periodStart() + ":");
            for (MetricsTrend.HookTrend trend : MetricsTrend.compare(previous, current)) {
                out.printf(
                        "  %-24s success_rate %+.1f%%  p95 %+dms  runs %d -> %d%n",
                        trend.hookName(),
                        trend.successRateDelta() * 100,
                        trend.p95DeltaMs(),
                        trend.previousCount(),
                        trend.currentCount());
            }
        }
        return ExitCodes.OK;
    }

    private static void printStats(PrintStream out, String label, Stats stats) {
        out.printf(
                "%-26s count=%d success=%d failed=%d timeout=%d error=%d violations=%d"
                        + " p50=%dms p95=%dms p99=%dms success_rate=%.1f%%%n",
                label,
                stats.count(),
                stats.success(),
                stats.failed(),
                stats.timeout(),
                stats.error(),
                stats.securityViolations(),
                stats.p50(),
                stats.p95(),
                stats.p99(),
                stats.successRate() * 100);
    }
}
