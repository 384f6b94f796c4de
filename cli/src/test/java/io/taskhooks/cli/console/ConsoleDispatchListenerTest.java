package io.taskhooks.cli.console;

import static org.assertj.core.api.Assertions.assertThat;

import io.taskhooks.core.dispatch.DispatchState;
import io.taskhooks.core.model.ExecutionStatus;
import io.taskhooks.core.spi.DispatchListener.EventBlockedEvent;
import io.taskhooks.core.spi.DispatchListener.HookCompletedEvent;
import io.taskhooks.core.spi.DispatchListener.HooksMatchedEvent;
import io.taskhooks.core.spi.DispatchListener.StateChangedEvent;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;

class ConsoleDispatchListenerTest {

    private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();
    private final ConsoleDispatchListener listener =
            new ConsoleDispatchListener(new PrintStream(bytes, true, StandardCharsets.UTF_8));

    private String printed() {
        return bytes.toString(StandardCharsets.UTF_8);
    }

    @Test
    void matchedHooksAreListed() {
        listener.onHooksMatched(new HooksMatchedEvent("evt_1", "task.completed", List.of("notify", "gate")));

        assertThat(printed()).isEqualTo("task.completed evt_1 -> notify, gate" + System.lineSeparator());
    }

    @Test
    void eventsWithoutHooksAreQuiet() {
        listener.onHooksMatched(new HooksMatchedEvent("evt_1", "task.created", List.of()));
        listener.onStateChanged(new StateChangedEvent("evt_1", DispatchState.IDLE, DispatchState.MATCHING));

        assertThat(printed()).isEmpty();
    }

    @Test
    void completionAndBlockingArePrinted() {
        listener.onHookCompleted(new HookCompletedEvent("evt_1", "gate", ExecutionStatus.FAILED, 42));
        listener.onEventBlocked(
                new EventBlockedEvent("evt_1", "task.completed", "gate", ExecutionStatus.FAILED, "gate says no"));

        assertThat(printed())
                .contains("gate")
                .contains("failed")
                .contains("42 ms")
                .contains("  BLOCKED: gate says no");
    }
}
