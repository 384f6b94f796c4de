package io.taskhooks.core.metrics;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Result of {@link HealthCheck#evaluate}.
 *
 * @param status   worst status across all hooks
 * @param perHook  status per hook
 * @param warnings human-readable findings
 * @param window   the evaluated window
 */
public record HealthReport(
        HealthStatus status, Map<String, HealthStatus> perHook, List<String> warnings, MetricsWindow window) {

    public enum HealthStatus {
        HEALTHY,
        DEGRADED,
        UNHEALTHY;

        HealthStatus worst(HealthStatus other) {
            return other.ordinal() > ordinal() ? other : this;
        }
    }

    public HealthReport {
        Objects.requireNonNull(status, "status must not be null");
        perHook = Collections.unmodifiableMap(new TreeMap<>(perHook));
        warnings = List.copyOf(warnings);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
