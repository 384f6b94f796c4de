package io.taskhooks.core.spi;

import io.taskhooks.core.dispatch.DispatchState;
import io.taskhooks.core.model.ExecutionStatus;
import java.util.List;

/**
 * SPI for observing dispatch progress, e.g. for console progress output or telemetry bridges.
 *
 * <p>
 * All methods receive immutable event objects. Exceptions thrown by listeners are caught by the
 * dispatcher and logged; they do not affect hook execution or the dispatch outcome.
 */
public interface DispatchListener {

    /** Called on every dispatcher state transition. */
    void onStateChanged(StateChangedEvent event);

    /** Called once per event after matching, also when nothing matched. */
    void onHooksMatched(HooksMatchedEvent event);

    /** Called after each hook's record has been appended to the audit log. */
    void onHookCompleted(HookCompletedEvent event);

    /** Called when a fail-stop hook blocks the event. */
    void onEventBlocked(EventBlockedEvent event);

    // --- Event records ---

    record StateChangedEvent(String eventId, DispatchState from, DispatchState to) {}

    record HooksMatchedEvent(String eventId, String eventType, List<String> hookNames) {}

    record HookCompletedEvent(String eventId, String hookName, ExecutionStatus status, long durationMs) {}

    record EventBlockedEvent(String eventId, String eventType, String hookName, ExecutionStatus status, String message) {}
}
