package io.taskhooks.core.metrics;

import io.taskhooks.core.model.HookExecutionRecord;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Folds audit records into fixed, epoch-aligned periods. Windows are always rebuilt from the
 * records, so counters never go backwards while the log only grows.
 */
public final class MetricsAggregator {

    public static final Duration DEFAULT_PERIOD = Duration.ofHours(1);

    private final Duration period;

    public MetricsAggregator() {
        this(DEFAULT_PERIOD);
    }

    public MetricsAggregator(Duration period) {
        this.period = Objects.requireNonNull(period, "period must not be null");
        if (period.isZero() || period.isNegative()) {
            throw new IllegalArgumentException("period must be positive, got: " + period);
        }
    }

    public Duration period() {
        return period;
    }

    /** Start of the window containing the instant. */
    public Instant windowStart(Instant instant) {
        long periodMillis = period.toMillis();
        return Instant.ofEpochMilli(Math.floorDiv(instant.toEpochMilli(), periodMillis) * periodMillis);
    }

    /** One window per period that has at least one record, oldest first. */
    public List<MetricsWindow> aggregate(List<HookExecutionRecord> records) {
        TreeMap<Instant, List<HookExecutionRecord>> byWindow = new TreeMap<>();
        for (HookExecutionRecord record : records) {
            byWindow.computeIfAbsent(windowStart(record.timestamp()), k -> new ArrayList<>()).add(record);
        }
        List<MetricsWindow> windows = new ArrayList<>(byWindow.size());
        byWindow.forEach((start, group) -> windows.add(build(start, group)));
        return windows;
    }

    /** The window containing {@code now}, empty if no record falls into it. */
    public MetricsWindow current(List<HookExecutionRecord> records, Instant now) {
        Instant start = windowStart(now);
        List<HookExecutionRecord> group = new ArrayList<>();
        for (HookExecutionRecord record : records) {
            if (windowStart(record.timestamp()).equals(start)) {
                group.add(record);
            }
        }
        return group.isEmpty() ? MetricsWindow.empty(start, start.plus(period)) : build(start, group);
    }

    private MetricsWindow build(Instant start, List<HookExecutionRecord> group) {
        Map<String, List<HookExecutionRecord>> byHook = new HashMap<>();
        Map<String, List<HookExecutionRecord>> byType = new HashMap<>();
        Map<String, Long> timeouts = new HashMap<>();
        for (HookExecutionRecord record : group) {
            String hook = record.hook().name();
            byHook.computeIfAbsent(hook, k -> new ArrayList<>()).add(record);
            byType.computeIfAbsent(record.event().type(), k -> new ArrayList<>()).add(record);
            timeouts.merge(hook, record.execution().timeoutMs(), Math::max);
        }
        Map<String, Stats> perHook = new HashMap<>();
        byHook.forEach((name, list) -> perHook.put(name, Stats.of(list)));
        Map<String, Stats> perType = new HashMap<>();
        byType.forEach((type, list) -> perType.put(type, Stats.of(list)));
        return new MetricsWindow(start, start.plus(period), Stats.of(group), perHook, perType, timeouts);
    }
}
