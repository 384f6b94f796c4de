package io.taskhooks.core.metrics;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Aggregated statistics for one period.
 *
 * @param periodStart  inclusive start
 * @param periodEnd    exclusive end
 * @param global       stats over every record in the window
 * @param perHook      stats keyed by hook name
 * @param perEventType stats keyed by event type
 * @param hookTimeouts largest configured timeout seen per hook, in milliseconds
 */
public record MetricsWindow(
        Instant periodStart,
        Instant periodEnd,
        Stats global,
        Map<String, Stats> perHook,
        Map<String, Stats> perEventType,
        Map<String, Long> hookTimeouts) {

    public MetricsWindow {
        Objects.requireNonNull(periodStart, "periodStart must not be null");
        Objects.requireNonNull(periodEnd, "periodEnd must not be null");
        Objects.requireNonNull(global, "global must not be null");
        perHook = Collections.unmodifiableMap(new TreeMap<>(perHook));
        perEventType = Collections.unmodifiableMap(new TreeMap<>(perEventType));
        hookTimeouts = Collections.unmodifiableMap(new TreeMap<>(hookTimeouts));
    }

    public static MetricsWindow empty(Instant start, Instant end) {
        return new MetricsWindow(start, end, Stats.EMPTY, Map.of(), Map.of(), Map.of());
    }

    /** True once the window's end is at or before {@code now}. */
    public boolean isCompleteAt(Instant now) {
        return !periodEnd.isAfter(now);
    }
}
