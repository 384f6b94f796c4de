package io.taskhooks.core.pipeline;

import io.taskhooks.core.dispatch.DispatchResult;
import io.taskhooks.core.model.Event;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one {@link HookPipeline#run}.
 *
 * @param outcome         overall outcome
 * @param events          emitted events in dispatch order
 * @param dispatchResults one result per event
 * @param message         error or blocking message, null on success
 */
public record PipelineResult(Outcome outcome, List<Event> events, List<DispatchResult> dispatchResults, String message) {

    public enum Outcome {
        /** No tracked work item changed between the revisions. */
        NO_CHANGES(0),
        /** All events dispatched; no fail-stop hook failed. */
        COMPLETED(0),
        /** At least one fail-stop hook failed. */
        BLOCKED(2),
        /** The hooks configuration is invalid; nothing was executed. */
        CONFIGURATION_ERROR(3);

        private final int exitCode;

        Outcome(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() {
            return exitCode;
        }
    }

    public PipelineResult {
        Objects.requireNonNull(outcome, "outcome must not be null");
        events = List.copyOf(events);
        dispatchResults = List.copyOf(dispatchResults);
    }

    public int exitCode() {
        return outcome.exitCode();
    }

    /** Dispatch results that blocked their event. */
    public List<DispatchResult> blocked() {
        return dispatchResults.stream().filter(DispatchResult::isBlocked).toList();
    }
}
