package io.taskhooks.core.dispatch;

/**
 * Dispatcher lifecycle for one event:
 * {@code IDLE -> MATCHING -> DISPATCHING -> (EXECUTING -> RECORDING)* -> IDLE}.
 * A non-matching event goes straight from MATCHING back to IDLE.
 */
public enum DispatchState {
    IDLE,
    MATCHING,
    DISPATCHING,
    EXECUTING,
    RECORDING
}
