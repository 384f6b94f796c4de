package io.taskhooks.cli.console;

import io.taskhooks.core.spi.DispatchListener;
import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints a line per matched event, per completed hook and per blocked event. State
 * transitions are not printed.
 */
public final class ConsoleDispatchListener implements DispatchListener {

    private final PrintStream out;

    public ConsoleDispatchListener(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public void onStateChanged(StateChangedEvent event) {
        // not shown
    }

    @Override
    public void onHooksMatched(HooksMatchedEvent event) {
        if (event.hookNames().isEmpty()) {
            return;
        }
        out.printf("%s %s -> %s%n", event.eventType(), event.eventId(), String.join(", ", event.hookNames()));
    }

    @Override
    public void onHookCompleted(HookCompletedEvent event) {
        out.printf("  %-24s %-8s %6d ms%n", event.hookName(), event.status().wireName(), event.durationMs());
    }

    @Override
    public void onEventBlocked(EventBlockedEvent event) {
        out.println("  BLOCKED: " + event.message());
    }
}
