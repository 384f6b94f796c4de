package io.taskhooks.core.metrics;

import static io.taskhooks.core.testkit.ExecutionRecords.record;
import static io.taskhooks.core.testkit.ExecutionRecords.success;
import static org.assertj.core.api.Assertions.assertThat;

import io.taskhooks.core.audit.AuditLogReader;
import io.taskhooks.core.audit.JsonlAuditLog;
import io.taskhooks.core.model.ExecutionStatus;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("Metrics persistence")
class MetricsStoreTest {

    private static final Instant TEN = Instant.parse("2024-05-01T10:00:00Z");
    private static final Instant NOW = Instant.parse("2024-05-01T12:30:00Z");

    @TempDir
    Path dir;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final MetricsAggregator aggregator = new MetricsAggregator();
    private MetricsStore store;

    @BeforeEach
    void setUp() {
        store = new MetricsStore(dir.resolve("metrics"), clock);
    }

    private List<MetricsWindow> windows() {
        return aggregator.aggregate(List.of(
                success("notify", 10, TEN.plusSeconds(60)),
                record("lint", "task.created", ExecutionStatus.FAILED, 20, TEN.plusSeconds(120)),
                success("notify", 30, NOW.minusSeconds(60))));
    }

    @Test
    void windowsAreWrittenOnePerFileAndLoadBack() {
        List<MetricsWindow> windows = windows();

        assertThat(store.refresh(windows)).isEqualTo(2);

        assertThat(store.fileFor(TEN)).exists();
        assertThat(store.fileFor(TEN).getFileName().toString()).isEqualTo("metrics-20240501T100000Z.json");
        assertThat(store.load()).containsExactlyElementsOf(windows);
    }

    @Test
    void completedWindowsAreNotRewritten() throws IOException {
        store.refresh(windows());
        String before = Files.readString(store.fileFor(TEN));

        assertThat(store.refresh(windows())).isEqualTo(1);
        assertThat(Files.readString(store.fileFor(TEN))).isEqualTo(before);
    }

    @Test
    @DisplayName("a completed window stored while still open is brought up to date")
    void staleCompletedWindowIsRewritten() {
        Clock early = Clock.fixed(TEN.plusSeconds(90), ZoneOffset.UTC);
        new MetricsStore(store.directory(), early)
                .refresh(aggregator.aggregate(List.of(success("notify", 10, TEN.plusSeconds(60)))));
        assertThat(store.load()).singleElement().satisfies(w -> assertThat(w.global().count()).isEqualTo(1));

        List<MetricsWindow> windows = windows();
        assertThat(store.refresh(windows)).isEqualTo(2);

        assertThat(store.load()).containsExactlyElementsOf(windows);
        assertThat(store.load().get(0).global().count()).isEqualTo(2);
    }

    @Test
    void unreadableCompletedWindowIsRewritten() throws IOException {
        store.refresh(windows());
        Files.writeString(store.fileFor(TEN), "{oops");

        assertThat(store.refresh(windows())).isEqualTo(2);
        assertThat(store.load()).containsExactlyElementsOf(windows());
    }

    @Test
    void historyReturnsMostRecent() {
        store.refresh(windows());

        assertThat(store.history(1))
                .singleElement()
                .satisfies(w -> assertThat(w.periodStart()).isEqualTo(Instant.parse("2024-05-01T12:00:00Z")));
        assertThat(store.history(10)).hasSize(2);
    }

    @Test
    void unreadableFilesAreSkipped() throws IOException {
        store.refresh(windows());
        Files.writeString(store.directory().resolve("metrics-garbage.json"), "{oops");

        assertThat(store.load()).hasSize(2);
    }

    @Test
    void missingDirectoryLoadsNothing() {
        assertThat(store.load()).isEmpty();
    }

    @Test
    void serviceRebuildsFromTheAuditLog() {
        Path auditFile = dir.resolve("audit.log");
        JsonlAuditLog log = new JsonlAuditLog(auditFile);
        log.append(success("notify", 10, TEN.plusSeconds(60)));
        log.append(success("notify", 40, NOW.minusSeconds(60)));
        MetricsService service = new MetricsService(new AuditLogReader(auditFile), aggregator, store, clock);

        assertThat(service.refresh()).hasSize(2);
        assertThat(service.current().global().count()).isEqualTo(1);
        assertThat(service.current().global().p95()).isEqualTo(40);

        store.clear();
        assertThat(store.load()).isEmpty();
        assertThat(service.rebuild()).hasSize(2);
        assertThat(service.history(5)).hasSize(2);
    }
}
