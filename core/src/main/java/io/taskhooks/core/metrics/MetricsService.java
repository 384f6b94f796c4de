package io.taskhooks.core.metrics;

import io.taskhooks.core.audit.AuditLogReader;
import io.taskhooks.core.model.HookExecutionRecord;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Rebuilds metrics windows from the audit log and keeps the metrics store current. */
public final class MetricsService {

    private static final Logger LOG = LoggerFactory.getLogger(MetricsService.class);

    private final AuditLogReader auditReader;
    private final MetricsAggregator aggregator;
    private final MetricsStore store;
    private final Clock clock;

    public MetricsService(AuditLogReader auditReader, MetricsAggregator aggregator, MetricsStore store, Clock clock) {
        this.auditReader = Objects.requireNonNull(auditReader, "auditReader must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /** Aggregates the whole audit log and writes new or still-open windows. */
    public List<MetricsWindow> refresh() {
        List<MetricsWindow> windows = aggregator.aggregate(auditReader.records());
        int written = store.refresh(windows);
        LOG.debug("Refreshed metrics: {} window(s), {} written", windows.size(), written);
        return windows;
    }

    /** Discards stored windows and rebuilds all of them from the audit log. */
    public List<MetricsWindow> rebuild() {
        store.clear();
        LOG.info("Rebuilding metrics from audit log");
        return refresh();
    }

    /** The window containing the current time. */
    public MetricsWindow current() {
        List<HookExecutionRecord> records = auditReader.records();
        return aggregator.current(records, clock.instant());
    }

    public List<MetricsWindow> history(int count) {
        return store.history(count);
    }
}
