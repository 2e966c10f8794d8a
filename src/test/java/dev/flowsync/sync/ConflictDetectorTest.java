package dev.flowsync.sync;

import dev.flowsync.config.SyncProperties;
import dev.flowsync.domain.change.ChangeEvent;
import dev.flowsync.domain.change.ChangePayload;
import dev.flowsync.domain.conflict.SyncConflict;
import dev.flowsync.domain.enums.ConflictType;
import dev.flowsync.domain.enums.ExecutionState;
import dev.flowsync.domain.enums.Resolution;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConflictDetectorTest {

    private final ConflictDetector detector = new ConflictDetector(SyncProperties.defaults(),
            Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC));

    @Nested
    @DisplayName("classification")
    class Classification {

        @Test
        @DisplayName("modification against removal of the same block is a block modification conflict")
        void modifyVersusRemove() {
            SyncConflict conflict = detect(
                    visual(1000, ChangePayload.NodeModified.of("n1", "name", "A")),
                    chat(1200, new ChangePayload.NodeRemoved("n1")));

            assertThat(conflict.type()).isEqualTo(ConflictType.CONCURRENT_BLOCK_MODIFICATION);
            assertThat(conflict.autoResolvable()).isFalse();
        }

        @Test
        @DisplayName("two removals of the same connection are a connection change conflict")
        void sameEdge() {
            SyncConflict conflict = detect(
                    visual(1000, new ChangePayload.EdgeRemoved("e1")),
                    chat(1500, new ChangePayload.EdgeRemoved("e1")));

            assertThat(conflict.type()).isEqualTo(ConflictType.CONCURRENT_CONNECTION_CHANGE);
        }

        @Test
        @DisplayName("a connection to a block removed on the other side is structural")
        void dependentConnection() {
            SyncConflict conflict = detect(
                    visual(1000, new ChangePayload.NodeRemoved("n1")),
                    chat(1100, new ChangePayload.EdgeAdded("e9", "n1", "n2")));

            assertThat(conflict.type()).isEqualTo(ConflictType.STRUCTURAL_CONFLICT);
        }

        @Test
        @DisplayName("execution-state changes only conflict with each other")
        void executionState() {
            ChangeEvent pause = chat(100, new ChangePayload.ExecutionStateChanged(ExecutionState.PAUSED));

            assertThat(detector.detect(pause, visual(300, new ChangePayload.ExecutionStateChanged(ExecutionState.RUNNING))))
                    .get().extracting(SyncConflict::type).isEqualTo(ConflictType.EXECUTION_STATE_CONFLICT);
            assertThat(detector.detect(pause, visual(300, ChangePayload.NodeModified.of("n1", "name", "x"))))
                    .isEmpty();
        }

        @Test
        @DisplayName("a node and an edge sharing an id are different entities")
        void nodeAndEdgeWithSameId() {
            assertThat(detector.detect(
                    visual(1000, new ChangePayload.NodeRemoved("x1")),
                    chat(1000, new ChangePayload.EdgeRemoved("x1")))).isEmpty();
        }
    }

    @Nested
    @DisplayName("determinism")
    class Determinism {

        @Test
        @DisplayName("the same pair always yields the same type and suggestion")
        void samePairSameVerdict() {
            ChangeEvent v = visual(1000, ChangePayload.NodeModified.of("n1", "label", "A"));
            ChangeEvent c = chat(1500, ChangePayload.NodeModified.of("n1", "status", "B"));

            SyncConflict first = detect(v, c);
            SyncConflict second = detect(c, v);

            assertThat(second.type()).isEqualTo(first.type());
            assertThat(second.suggestedResolution()).isEqualTo(first.suggestedResolution()).isEqualTo(Resolution.CHAT);
            assertThat(second.autoResolvable()).isEqualTo(first.autoResolvable()).isTrue();
        }

        @Test
        @DisplayName("the later change is suggested; ties go to the visual side")
        void suggestionFollowsTimestamps() {
            assertThat(detect(visual(2000, new ChangePayload.EdgeRemoved("e1")), chat(1000, new ChangePayload.EdgeRemoved("e1")))
                    .suggestedResolution()).isEqualTo(Resolution.VISUAL);
            assertThat(detect(visual(1000, new ChangePayload.EdgeRemoved("e1")), chat(1000, new ChangePayload.EdgeRemoved("e1")))
                    .suggestedResolution()).isEqualTo(Resolution.VISUAL);
        }
    }

    @Test
    @DisplayName("the window boundary is inclusive")
    void windowBoundary() {
        assertThat(detector.detect(visual(1000, new ChangePayload.EdgeRemoved("e1")), chat(3000, new ChangePayload.EdgeRemoved("e1"))))
                .isPresent();
        assertThat(detector.detect(visual(1000, new ChangePayload.EdgeRemoved("e1")), chat(3001, new ChangePayload.EdgeRemoved("e1"))))
                .isEmpty();
    }

    @Test
    @DisplayName("changes from the same source are a programming error")
    void sameSourceRejected() {
        assertThatThrownBy(() -> detector.detect(
                visual(1000, new ChangePayload.EdgeRemoved("e1")),
                visual(1000, new ChangePayload.EdgeRemoved("e1"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ── Test Fixtures ──────────────────────────────────────────────

    private SyncConflict detect(ChangeEvent incoming, ChangeEvent other) {
        Optional<SyncConflict> conflict = detector.detect(incoming, other);
        assertThat(conflict).isPresent();
        return conflict.get();
    }

    private static ChangeEvent visual(long timestamp, ChangePayload payload) {
        return ChangeEvent.visual("v-" + timestamp + "-" + payload.targetId(), timestamp, payload, "editor");
    }

    private static ChangeEvent chat(long timestamp, ChangePayload payload) {
        return ChangeEvent.chat("c-" + timestamp + "-" + payload.targetId(), timestamp, payload, "user");
    }
}
