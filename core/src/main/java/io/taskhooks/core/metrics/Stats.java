package io.taskhooks.core.metrics;

import io.taskhooks.core.model.HookExecutionRecord;
import java.util.Arrays;
import java.util.Collection;

/**
 * Execution statistics over a group of audit records. Durations are in milliseconds;
 * percentiles use the nearest-rank method over every duration in the group.
 */
public record Stats(
        long count,
        long success,
        long failed,
        long timeout,
        long error,
        long securityViolations,
        long p50,
        long p95,
        long p99,
        long min,
        long max,
        double mean) {

    public static final Stats EMPTY = new Stats(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0.0);

    public static Stats of(Collection<HookExecutionRecord> records) {
        if (records.isEmpty()) {
            return EMPTY;
        }
        long success = 0;
        long failed = 0;
        long timeout = 0;
        long error = 0;
        long violations = 0;
        long[] durations = new long[records.size()];
        long total = 0;
        int i = 0;
        for (HookExecutionRecord record : records) {
            switch (record.status()) {
                case SUCCESS -> success++;
                case FAILED -> failed++;
                case TIMEOUT -> timeout++;
                case ERROR -> error++;
            }
            if (record.isSecurityViolation()) {
                violations++;
            }
            long duration = record.execution().durationMs();
            durations[i++] = duration;
            total += duration;
        }
        Arrays.sort(durations);
        return new Stats(
                records.size(),
                success,
                failed,
                timeout,
                error,
                violations,
                Percentiles.nearestRank(durations, 50),
                Percentiles.nearestRank(durations, 95),
                Percentiles.nearestRank(durations, 99),
                durations[0],
                durations[durations.length - 1],
                (double) total / durations.length);
    }

    /** Fraction of successful executions, 1.0 when there were none. */
    public double successRate() {
        return count == 0 ? 1.0 : (double) success / count;
    }
}
