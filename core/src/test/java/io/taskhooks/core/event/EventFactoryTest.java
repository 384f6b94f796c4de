package io.taskhooks.core.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.taskhooks.core.model.Event;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class EventFactoryTest {

    private static final Instant NOW = Instant.parse("2024-05-05T12:00:00Z");

    private final EventFactory factory = new EventFactory("/repo", Clock.fixed(NOW, ZoneOffset.UTC));

    @ParameterizedTest
    @ValueSource(strings = {"task.created", "deploy.finished", "task.ac_checked"})
    void acceptsDomainActionTypes(String type) {
        assertThat(EventFactory.isValidType(type)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"task", "Task.created", "task.created.now", "task.", ".created", "task-created"})
    void rejectsOtherTypes(String type) {
        assertThat(EventFactory.isValidType(type)).isFalse();
    }

    @Test
    void createUsesClockAndManualSource() {
        Event event = factory.create("deploy.finished", Map.of("env", "prod"));

        assertThat(event.timestamp()).isEqualTo(NOW);
        assertThat(event.eventId()).startsWith("evt_");
        assertThat(event.metadata()).containsEntry("source", "manual");
        assertThat(event.contextValue("env")).isEqualTo("prod");
    }

    @Test
    void createRejectsInvalidType() {
        assertThatThrownBy(() -> factory.create("nope", Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope");
    }

    @Test
    void mockProvidesPlausibleContext() {
        Event completed = factory.mock("task.completed", null);
        assertThat(completed.contextValue("task_id")).isEqualTo("task-0");
        assertThat(completed.contextValue("status")).isEqualTo("Done");

        Event checked = factory.mock("task.ac_checked", "task-9");
        assertThat(checked.contextValue("task_id")).isEqualTo("task-9");
        assertThat(checked.contextValue("checked_delta")).isEqualTo(1);
    }
}
