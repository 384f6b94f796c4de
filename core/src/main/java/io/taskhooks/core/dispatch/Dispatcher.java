package io.taskhooks.core.dispatch;

import io.taskhooks.core.audit.AuditSink;
import io.taskhooks.core.exec.HookExecution;
import io.taskhooks.core.exec.SandboxedExecutor;
import io.taskhooks.core.hook.HookMatcher;
import io.taskhooks.core.hook.HookRegistry;
import io.taskhooks.core.model.Event;
import io.taskhooks.core.model.FailMode;
import io.taskhooks.core.model.HookDefinition;
import io.taskhooks.core.model.HookExecutionRecord;
import io.taskhooks.core.spi.DispatchListener;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Routes events to matching hooks and applies fail-mode policy.
 *
 * <p>
 * For each event: match against the registry; if nothing matches, log and return
 * {@link DispatchResult.Outcome#NO_MATCH} without auditing. Otherwise run each matched hook in
 * declaration order and append its record to the audit sink before moving on. A failed
 * {@code continue} hook logs a warning and dispatch proceeds (fail-open). A failed {@code stop}
 * hook skips the remaining hooks for this event and yields
 * {@link DispatchResult.Outcome#BLOCKED} (fail-stop). Security violations count as failures.
 *
 * <p>
 * Not thread-safe: one dispatcher serves one triggering operation at a time.
 */
public final class Dispatcher {

    private static final Logger LOG = LoggerFactory.getLogger(Dispatcher.class);

    static final String MDC_EVENT_ID = "eventId";
    static final String MDC_HOOK_NAME = "hookName";

    private final HookRegistry registry;
    private final SandboxedExecutor executor;
    private final AuditSink auditSink;
    private final DispatchListener listener;
    private DispatchState state = DispatchState.IDLE;

    /**
     * @param registry  configured hooks
     * @param executor  runs hook actions
     * @param auditSink receives one record per execution
     * @param listener  optional progress listener, may be null
     */
    public Dispatcher(
            HookRegistry registry, SandboxedExecutor executor, AuditSink auditSink, DispatchListener listener) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.auditSink = Objects.requireNonNull(auditSink, "auditSink must not be null");
        this.listener = listener;
    }

    public DispatchState state() {
        return state;
    }

    public DispatchResult dispatch(Event event) {
        return dispatch(event, false);
    }

    /**
     * Dispatches one event.
     *
     * @param dryRun when true, report matches only; nothing is executed or audited
     */
    public DispatchResult dispatch(Event event, boolean dryRun) {
        Objects.requireNonNull(event, "event must not be null");
        MDC.put(MDC_EVENT_ID, event.eventId());
        try {
            transition(event, DispatchState.MATCHING);
            List<HookDefinition> matches = HookMatcher.findMatches(registry, event);
            List<String> names = matches.stream().map(HookDefinition::name).toList();
            notifyMatched(event, names);

            if (matches.isEmpty()) {
                LOG.info("No hooks matched event {} ({})", event.eventId(), event.eventType());
                return new DispatchResult(event, DispatchResult.Outcome.NO_MATCH, names, List.of(), List.of(), null);
            }
            if (dryRun) {
                LOG.info("[dry-run] Event {} ({}) would run: {}", event.eventId(), event.eventType(), names);
                return new DispatchResult(event, DispatchResult.Outcome.DRY_RUN, names, List.of(), List.of(), null);
            }

            transition(event, DispatchState.DISPATCHING);
            LOG.info("Dispatching event {} ({}) to {} hook(s)", event.eventId(), event.eventType(), matches.size());
            List<HookExecution> executions = new ArrayList<>();
            for (int i = 0; i < matches.size(); i++) {
                HookDefinition hook = matches.get(i);
                HookExecution execution = runOne(hook, event);
                executions.add(execution);
                if (execution.succeeded()) {
                    continue;
                }
                HookExecutionRecord record = execution.record();
                if (hook.failMode() == FailMode.STOP) {
                    String message = String.format(
                            "Hook '%s' blocked event %s (%s): %s%s",
                            hook.name(),
                            event.eventId(),
                            event.eventType(),
                            failureKind(record),
                            record.error() != null ? " - " + record.error() : "");
                    LOG.error(message);
                    List<String> skipped = names.subList(i + 1, names.size());
                    if (!skipped.isEmpty()) {
                        LOG.error("Skipping remaining hook(s) for event {}: {}", event.eventId(), skipped);
                    }
                    notifyBlocked(event, hook, record, message);
                    return new DispatchResult(
                            event, DispatchResult.Outcome.BLOCKED, names, executions, skipped, message);
                }
                LOG.warn(
                        "Hook '{}' failed for event {} ({}): {}; continuing (fail_mode=continue)",
                        hook.name(),
                        event.eventId(),
                        failureKind(record),
                        record.error());
            }
            return new DispatchResult(event, DispatchResult.Outcome.COMPLETED, names, executions, List.of(), null);
        } finally {
            transition(event, DispatchState.IDLE);
            MDC.remove(MDC_EVENT_ID);
        }
    }

    private HookExecution runOne(HookDefinition hook, Event event) {
        MDC.put(MDC_HOOK_NAME, hook.name());
        try {
            transition(event, DispatchState.EXECUTING);
            HookExecution execution = executor.execute(hook, event);
            transition(event, DispatchState.RECORDING);
            auditSink.append(execution.record());
            notifyCompleted(event, execution.record());
            return execution;
        } finally {
            MDC.remove(MDC_HOOK_NAME);
        }
    }

    /** {@code security_violation}, {@code timeout}, {@code failed} or {@code error}. */
    static String failureKind(HookExecutionRecord record) {
        return record.isSecurityViolation() ? "security_violation" : record.status().wireName();
    }

    private void transition(Event event, DispatchState next) {
        DispatchState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        LOG.trace("Dispatcher {} -> {}", previous, next);
        if (listener == null) {
            return;
        }
        try {
            listener.onStateChanged(new DispatchListener.StateChangedEvent(event.eventId(), previous, next));
        } catch (Exception e) {
            LOG.warn("DispatchListener.onStateChanged failed", e);
        }
    }

    private void notifyMatched(Event event, List<String> names) {
        if (listener == null) {
            return;
        }
        try {
            listener.onHooksMatched(new DispatchListener.HooksMatchedEvent(event.eventId(), event.eventType(), names));
        } catch (Exception e) {
            LOG.warn("DispatchListener.onHooksMatched failed", e);
        }
    }

    private void notifyCompleted(Event event, HookExecutionRecord record) {
        if (listener == null) {
            return;
        }
        try {
            listener.onHookCompleted(new DispatchListener.HookCompletedEvent(
                    event.eventId(),
                    record.hook().name(),
                    record.status(),
                    record.execution().durationMs()));
        } catch (Exception e) {
            LOG.warn("DispatchListener.onHookCompleted failed", e);
        }
    }

    private void notifyBlocked(Event event, HookDefinition hook, HookExecutionRecord record, String message) {
        if (listener == null) {
            return;
        }
        try {
            listener.onEventBlocked(new DispatchListener.EventBlockedEvent(
                    event.eventId(), event.eventType(), hook.name(), record.status(), message));
        } catch (Exception e) {
            LOG.warn("DispatchListener.onEventBlocked failed", e);
        }
    }
}
