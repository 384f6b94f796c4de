package io.taskhooks.core.dispatch;

import io.taskhooks.core.exec.HookExecution;
import io.taskhooks.core.model.Event;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of dispatching one event.
 *
 * @param event        the dispatched event
 * @param outcome      overall outcome
 * @param matchedHooks names of all matching hooks, in declaration order
 * @param executions   executions that ran (or were rejected), in order
 * @param skippedHooks matching hooks not run because an earlier fail-stop hook failed
 * @param message      blocking message for {@link Outcome#BLOCKED}, otherwise null
 */
public record DispatchResult(
        Event event,
        Outcome outcome,
        List<String> matchedHooks,
        List<HookExecution> executions,
        List<String> skippedHooks,
        String message) {

    public enum Outcome {
        /** No enabled hook matched; nothing was executed or audited. */
        NO_MATCH,
        /** Every matched hook ran; failures, if any, were fail-open. */
        COMPLETED,
        /** A fail-stop hook failed; the triggering operation must fail. */
        BLOCKED,
        /** Matching only; nothing was executed or audited. */
        DRY_RUN
    }

    public DispatchResult {
        Objects.requireNonNull(event, "event must not be null");
        Objects.requireNonNull(outcome, "outcome must not be null");
        matchedHooks = List.copyOf(matchedHooks);
        executions = List.copyOf(executions);
        skippedHooks = List.copyOf(skippedHooks);
    }

    public boolean isBlocked() {
        return outcome == Outcome.BLOCKED;
    }

    /** Number of executions that did not succeed, whatever their fail mode. */
    public long failureCount() {
        return executions.stream().filter(e -> !e.succeeded()).count();
    }
}
