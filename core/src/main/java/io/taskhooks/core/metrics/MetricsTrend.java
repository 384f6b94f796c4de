package io.taskhooks.core.metrics;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/** Per-hook comparison between two windows. */
public final class MetricsTrend {

    /**
     * @param hookName         hook
     * @param successRateDelta current minus previous success rate
     * @param p95DeltaMs       current minus previous p95 duration
     * @param previousCount    executions in the previous window
     * @param currentCount     executions in the current window
     */
    public record HookTrend(
            String hookName, double successRateDelta, long p95DeltaMs, long previousCount, long currentCount) {}

    private MetricsTrend() {}

    /** One entry per hook present in either window, sorted by hook name. */
    public static List<HookTrend> compare(MetricsWindow previous, MetricsWindow current) {
        TreeSet<String> hooks = new TreeSet<>(previous.perHook().keySet());
        hooks.addAll(current.perHook().keySet());
        List<HookTrend> trends = new ArrayList<>();
        for (String hook : hooks) {
            Stats before = previous.perHook().getOrDefault(hook, Stats.EMPTY);
            Stats after = current.perHook().getOrDefault(hook, Stats.EMPTY);
            trends.add(new HookTrend(
                    hook,
                    after.successRate() - before.successRate(),
                    after.p95() - before.p95(),
                    before.count(),
                    after.count()));
        }
        return trends;
    }
}
