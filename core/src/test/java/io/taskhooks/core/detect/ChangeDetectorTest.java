package io.taskhooks.core.detect;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import io.taskhooks.core.model.AcceptanceItem;
import io.taskhooks.core.model.Delta;
import io.taskhooks.core.model.DeltaKind;
import io.taskhooks.core.model.Snapshot;
import io.taskhooks.core.snapshot.SnapshotSet;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ChangeDetector")
class ChangeDetectorTest {

    private final ChangeDetector detector = new ChangeDetector();

    private static Snapshot task(String id, String status, boolean... checked) {
        List<AcceptanceItem> items = new ArrayList<>();
        for (int i = 0; i < checked.length; i++) {
            items.add(new AcceptanceItem(i + 1, "criterion " + (i + 1), checked[i]));
        }
        return new Snapshot(id, "backlog/tasks/" + id + ".md", "Title " + id, status, null, Set.of(), items);
    }

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("new item -> created only")
        void newItem() {
            DetectionResult result = detector.detect(SnapshotSet.empty(), SnapshotSet.of(task("task-1", "Done", true)));

            assertThat(result.deltas()).extracting(Delta::kind).containsExactly(DeltaKind.CREATED);
            assertThat(result.deltas().get(0).to()).isEqualTo("Done");
        }

        @Test
        @DisplayName("completion -> status change flagged completed")
        void completion() {
            DetectionResult result = detector.detect(
                    SnapshotSet.of(task("task-1", "In Progress")), SnapshotSet.of(task("task-1", "Done")));

            assertThat(result.deltas()).hasSize(1);
            Delta delta = result.deltas().get(0);
            assertThat(delta.kind()).isEqualTo(DeltaKind.STATUS_CHANGED);
            assertThat(delta.from()).isEqualTo("In Progress");
            assertThat(delta.to()).isEqualTo("Done");
            assertThat(delta.completed()).isTrue();
        }

        @Test
        @DisplayName("non-terminal status change is not completed")
        void nonTerminal() {
            DetectionResult result = detector.detect(
                    SnapshotSet.of(task("task-1", "To Do")), SnapshotSet.of(task("task-1", "In Progress")));
            assertThat(result.deltas().get(0).completed()).isFalse();
        }

        @Test
        @DisplayName("partial AC progress -> one ac_checked delta with count delta")
        void partialProgress() {
            DetectionResult result = detector.detect(
                    SnapshotSet.of(task("task-1", "In Progress", false, false, false)),
                    SnapshotSet.of(task("task-1", "In Progress", true, true, false)));

            assertThat(result.deltas()).hasSize(1);
            Delta delta = result.deltas().get(0);
            assertThat(delta.kind()).isEqualTo(DeltaKind.AC_CHECKED);
            assertThat(delta.checkedDelta()).isEqualTo(2);
            assertThat(delta.from()).isEqualTo("0");
            assertThat(delta.to()).isEqualTo("2");
        }

        @Test
        @DisplayName("unchecking -> ac_unchecked with negative delta")
        void unchecking() {
            DetectionResult result = detector.detect(
                    SnapshotSet.of(task("task-1", "In Progress", true, true)),
                    SnapshotSet.of(task("task-1", "In Progress", true, false)));

            assertThat(result.deltas()).extracting(Delta::kind).containsExactly(DeltaKind.AC_UNCHECKED);
            assertThat(result.deltas().get(0).checkedDelta()).isEqualTo(-1);
        }

        @Test
        @DisplayName("status and AC change on one item -> two independent deltas")
        void statusAndAcceptance() {
            DetectionResult result = detector.detect(
                    SnapshotSet.of(task("task-1", "In Progress", true, false)),
                    SnapshotSet.of(task("task-1", "Done", true, true)));

            assertThat(result.deltas())
                    .extracting(Delta::kind)
                    .containsExactly(DeltaKind.STATUS_CHANGED, DeltaKind.AC_CHECKED);
        }

        @Test
        @DisplayName("unrelated change (title only) -> nothing")
        void unrelatedChange() {
            Snapshot before = task("task-1", "To Do", false);
            Snapshot after = new Snapshot("task-1", before.path(), "Renamed", "To Do", "low", Set.of("x"), before.acceptanceItems());

            assertThat(detector.detect(SnapshotSet.of(before), SnapshotSet.of(after)).noChanges()).isTrue();
        }

        @Test
        @DisplayName("checking one box and unchecking another nets to nothing")
        void countDeltaNetsOut() {
            DetectionResult result = detector.detect(
                    SnapshotSet.of(task("task-1", "In Progress", true, false)),
                    SnapshotSet.of(task("task-1", "In Progress", false, true)));
            assertThat(result.noChanges()).isTrue();
        }

        @Test
        @DisplayName("deleted item -> nothing")
        void deletedItem() {
            assertThat(detector.detect(SnapshotSet.of(task("task-1", "Done")), SnapshotSet.empty()).noChanges())
                    .isTrue();
        }
    }

    @Test
    @DisplayName("deltas are ordered by ascending id")
    void orderedById() {
        SnapshotSet after = SnapshotSet.of(task("task-10", "To Do"), task("task-2", "To Do"), task("task-1.1", "To Do"));

        DetectionResult result = detector.detect(SnapshotSet.empty(), after);

        assertThat(result.deltas()).extracting(Delta::taskId).containsExactly("task-1.1", "task-2", "task-10");
    }

    @Test
    @DisplayName("detecting the same pair twice yields identical deltas")
    void idempotent() {
        SnapshotSet before = SnapshotSet.of(task("task-1", "To Do", false), task("task-2", "In Progress"));
        SnapshotSet after = SnapshotSet.of(task("task-1", "Done", true), task("task-3", "To Do"));

        assertThat(detector.detect(before, after)).isEqualTo(detector.detect(before, after));
    }

    @Test
    @DisplayName("a new id differing only in leading zeros is still created")
    void leadingZeroIdIsANewItem() {
        SnapshotSet before = SnapshotSet.of(task("task-1", "To Do"));
        SnapshotSet after = SnapshotSet.of(task("task-1", "To Do"), task("task-01", "To Do"));

        DetectionResult result = detector.detect(before, after);

        assertThat(after.ids()).hasSize(2);
        assertThat(result.deltas())
                .extracting(Delta::kind, Delta::taskId)
                .containsExactly(tuple(DeltaKind.CREATED, "task-01"));
    }

    @Test
    void identicalSnapshotsProduceNoDeltas() {
        SnapshotSet set = SnapshotSet.of(task("task-1", "Done", true));
        assertThat(detector.detect(set, set).noChanges()).isTrue();
    }

    @Test
    void customTerminalStatus() {
        ChangeDetector closed = new ChangeDetector("Closed");
        DetectionResult result = closed.detect(
                SnapshotSet.of(task("task-1", "Open")), SnapshotSet.of(task("task-1", "Closed")));
        assertThat(result.deltas().get(0).completed()).isTrue();
    }
}
