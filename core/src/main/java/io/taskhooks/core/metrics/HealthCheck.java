package io.taskhooks.core.metrics;

import io.taskhooks.core.metrics.HealthReport.HealthStatus;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Evaluates a metrics window against health thresholds.
 *
 * <p>
 * Per hook:
 * <ul>
 * <li>success rate below the minimum: DEGRADED, or UNHEALTHY when it is also below half the
 * minimum or the hook had security violations
 * <li>p95 duration at or above {@code nearTimeoutRatio} of the hook's timeout: DEGRADED
 * </ul>
 * The overall status is the worst per-hook status.
 */
public final class HealthCheck {

    public static final double DEFAULT_MIN_SUCCESS_RATE = 0.95;
    public static final double DEFAULT_NEAR_TIMEOUT_RATIO = 0.8;

    private final double minSuccessRate;
    private final double nearTimeoutRatio;

    public HealthCheck() {
        this(DEFAULT_MIN_SUCCESS_RATE, DEFAULT_NEAR_TIMEOUT_RATIO);
    }

    public HealthCheck(double minSuccessRate, double nearTimeoutRatio) {
        if (minSuccessRate < 0 || minSuccessRate > 1) {
            throw new IllegalArgumentException("minSuccessRate must be in [0, 1], got: " + minSuccessRate);
        }
        if (nearTimeoutRatio <= 0 || nearTimeoutRatio > 1) {
            throw new IllegalArgumentException("nearTimeoutRatio must be in (0, 1], got: " + nearTimeoutRatio);
        }
        this.minSuccessRate = minSuccessRate;
        this.nearTimeoutRatio = nearTimeoutRatio;
    }

    public HealthReport evaluate(MetricsWindow window) {
        Map<String, HealthStatus> perHook = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        HealthStatus overall = HealthStatus.HEALTHY;

        for (Map.Entry<String, Stats> entry : window.perHook().entrySet()) {
            String hook = entry.getKey();
            Stats stats = entry.getValue();
            HealthStatus status = HealthStatus.HEALTHY;

            double rate = stats.successRate();
            if (rate < minSuccessRate) {
                boolean severe = rate < minSuccessRate / 2 || stats.securityViolations() > 0;
                status = status.worst(severe ? HealthStatus.UNHEALTHY : HealthStatus.DEGRADED);
                warnings.add(String.format(
                        "%s: success rate %.1f%% below %.1f%% (%d of %d)",
                        hook, rate * 100, minSuccessRate * 100, stats.success(), stats.count()));
            }
            if (stats.securityViolations() > 0) {
                warnings.add(String.format("%s: %d security violation(s)", hook, stats.securityViolations()));
            }
            long timeoutMs = window.hookTimeouts().getOrDefault(hook, 0L);
            if (timeoutMs > 0 && stats.p95() >= nearTimeoutRatio * timeoutMs) {
                status = status.worst(HealthStatus.DEGRADED);
                warnings.add(String.format(
                        "%s: p95 %d ms is within %.0f%% of its %d ms timeout",
                        hook, stats.p95(), nearTimeoutRatio * 100, timeoutMs));
            }
            perHook.put(hook, status);
            overall = overall.worst(status);
        }
        return new HealthReport(overall, perHook, warnings, window);
    }
}
