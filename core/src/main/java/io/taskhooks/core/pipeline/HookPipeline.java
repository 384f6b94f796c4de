package io.taskhooks.core.pipeline;

import io.taskhooks.core.audit.AuditSink;
import io.taskhooks.core.detect.ChangeDetector;
import io.taskhooks.core.detect.DetectionResult;
import io.taskhooks.core.dispatch.DispatchResult;
import io.taskhooks.core.dispatch.Dispatcher;
import io.taskhooks.core.error.ConfigurationException;
import io.taskhooks.core.event.EventEmitter;
import io.taskhooks.core.exec.SandboxedExecutor;
import io.taskhooks.core.hook.HookRegistry;
import io.taskhooks.core.metrics.MetricsService;
import io.taskhooks.core.model.Event;
import io.taskhooks.core.model.Revision;
import io.taskhooks.core.snapshot.SnapshotParser;
import io.taskhooks.core.snapshot.SnapshotSet;
import io.taskhooks.core.spi.DispatchListener;
import io.taskhooks.core.spi.WorkItemStore;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * End-to-end run for one revision pair: load hooks, read both revisions, parse, detect, emit,
 * dispatch every event, refresh metrics.
 *
 * <p>
 * An invalid hooks configuration aborts the run before anything executes. A blocked event does
 * not stop later events from being dispatched, but makes the whole run
 * {@link PipelineResult.Outcome#BLOCKED}. Metrics refresh failures are logged and never change
 * the outcome.
 */
public final class HookPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(HookPipeline.class);

    private final WorkItemStore store;
    private final Supplier<HookRegistry> registrySource;
    private final SnapshotParser parser;
    private final ChangeDetector detector;
    private final EventEmitter emitter;
    private final SandboxedExecutor executor;
    private final AuditSink auditSink;
    private final MetricsService metrics;
    private final DispatchListener listener;

    private HookPipeline(Builder builder) {
        this.store = Objects.requireNonNull(builder.store, "store must not be null");
        this.registrySource = Objects.requireNonNull(builder.registrySource, "registrySource must not be null");
        this.parser = builder.parser != null ? builder.parser : new SnapshotParser();
        this.detector = builder.detector != null ? builder.detector : new ChangeDetector();
        this.emitter = Objects.requireNonNull(builder.emitter, "emitter must not be null");
        this.executor = Objects.requireNonNull(builder.executor, "executor must not be null");
        this.auditSink = Objects.requireNonNull(builder.auditSink, "auditSink must not be null");
        this.metrics = builder.metrics;
        this.listener = builder.listener;
    }

    public static Builder builder() {
        return new Builder();
    }

    public PipelineResult run(String beforeMarker, String afterMarker) {
        return run(beforeMarker, afterMarker, false);
    }

    /**
     * Runs the pipeline.
     *
     * @param beforeMarker revision to compare from (e.g. {@code HEAD~1})
     * @param afterMarker  revision to compare to (e.g. {@code HEAD})
     * @param dryRun       match and report only; no hook runs, nothing is audited
     * @throws io.taskhooks.core.error.WorkItemStoreException if a revision cannot be read
     */
    public PipelineResult run(String beforeMarker, String afterMarker, boolean dryRun) {
        HookRegistry registry;
        try {
            registry = registrySource.get();
        } catch (ConfigurationException e) {
            LOG.error("Hook execution disabled for this run: {}", e.getMessage());
            return new PipelineResult(PipelineResult.Outcome.CONFIGURATION_ERROR, List.of(), List.of(), e.getMessage());
        }

        Revision before = store.resolve(beforeMarker);
        Revision after = store.resolve(afterMarker);
        LOG.debug("Comparing revisions {} ({}) -> {} ({})", beforeMarker, before.id(), afterMarker, after.id());

        SnapshotSet beforeSet = parser.parseAll(store.list(before));
        SnapshotSet afterSet = parser.parseAll(store.list(after));
        DetectionResult detection = detector.detect(beforeSet, afterSet);
        if (detection.noChanges()) {
            return new PipelineResult(PipelineResult.Outcome.NO_CHANGES, List.of(), List.of(), null);
        }

        List<Event> events = emitter.emit(detection.deltas(), before, after);
        Dispatcher dispatcher = new Dispatcher(registry, executor, auditSink, listener);
        List<DispatchResult> results = new ArrayList<>(events.size());
        List<String> blockMessages = new ArrayList<>();
        for (Event event : events) {
            DispatchResult result = dispatcher.dispatch(event, dryRun);
            results.add(result);
            if (result.isBlocked()) {
                blockMessages.add(result.message());
            }
        }

        if (!dryRun) {
            refreshMetrics();
        }

        if (!blockMessages.isEmpty()) {
            return new PipelineResult(
                    PipelineResult.Outcome.BLOCKED, events, results, String.join("\n", blockMessages));
        }
        LOG.info("Dispatched {} event(s) from {} change(s)", events.size(), detection.size());
        return new PipelineResult(PipelineResult.Outcome.COMPLETED, events, results, null);
    }

    private void refreshMetrics() {
        if (metrics == null) {
            return;
        }
        try {
            metrics.refresh();
        } catch (RuntimeException e) {
            LOG.warn("Metrics refresh failed: {}", e.getMessage(), e);
        }
    }

    /** Builder for {@link HookPipeline}. Parser and detector default to the standard settings. */
    public static final class Builder {
        private WorkItemStore store;
        private Supplier<HookRegistry> registrySource;
        private SnapshotParser parser;
        private ChangeDetector detector;
        private EventEmitter emitter;
        private SandboxedExecutor executor;
        private AuditSink auditSink;
        private MetricsService metrics;
        private DispatchListener listener;

        private Builder() {}

        public Builder store(WorkItemStore store) {
            this.store = store;
            return this;
        }

        /** Called once per run; may throw {@link ConfigurationException}. */
        public Builder registrySource(Supplier<HookRegistry> registrySource) {
            this.registrySource = registrySource;
            return this;
        }

        public Builder parser(SnapshotParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder detector(ChangeDetector detector) {
            this.detector = detector;
            return this;
        }

        public Builder emitter(EventEmitter emitter) {
            this.emitter = emitter;
            return this;
        }

        public Builder executor(SandboxedExecutor executor) {
            this.executor = executor;
            return this;
        }

        public Builder auditSink(AuditSink auditSink) {
            this.auditSink = auditSink;
            return this;
        }

        public Builder metrics(MetricsService metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder listener(DispatchListener listener) {
            this.listener = listener;
            return this;
        }

        public HookPipeline build() {
            return new HookPipeline(this);
        }
    }
}
