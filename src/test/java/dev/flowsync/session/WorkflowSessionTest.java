package dev.flowsync.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.flowsync.config.StreamingProperties;
import dev.flowsync.config.SyncProperties;
import dev.flowsync.domain.change.ChangeEvent;
import dev.flowsync.domain.change.ChangePayload;
import dev.flowsync.domain.enums.ExecutionState;
import dev.flowsync.domain.enums.ExecutionStatus;
import dev.flowsync.domain.execution.ExecutionEvent;
import dev.flowsync.domain.execution.ExecutionEventDetail;
import dev.flowsync.domain.execution.JourneyDefinition;
import dev.flowsync.domain.graph.WorkflowGraph;
import dev.flowsync.domain.graph.WorkflowNode;
import dev.flowsync.exception.ExecutionAlreadyActiveException;
import dev.flowsync.exception.GraphMutationException;
import dev.flowsync.infrastructure.broadcast.SessionBroadcaster;
import dev.flowsync.infrastructure.engine.ExecutionEngine;
import dev.flowsync.infrastructure.journal.ExecutionJournal;
import dev.flowsync.streaming.ConversationalMessageFactory;
import dev.flowsync.streaming.ExecutionLogExporter;
import dev.flowsync.streaming.ExecutionSnapshot;
import dev.flowsync.streaming.ExecutionUpdate;
import dev.flowsync.sync.ConflictDetector;
import dev.flowsync.sync.ConflictResolver;
import dev.flowsync.sync.SyncSnapshot;
import dev.flowsync.sync.WorkflowStateSnapshotBuilder;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class WorkflowSessionTest {

    private ExecutionEngine engine;
    private SessionBroadcaster broadcaster;
    private WorkflowGraph graph;
    private WorkflowSession session;

    @BeforeEach
    void setUp() {
        engine = mock(ExecutionEngine.class);
        broadcaster = mock(SessionBroadcaster.class);
        graph = WorkflowGraph.of("wf-1",
                List.of(WorkflowNode.of("n1", "Fetch", "http"), WorkflowNode.of("n2", "Notify", "email")),
                List.of());
        session = factory(engine, broadcaster).create("s1", graph);
    }

    @Nested
    @DisplayName("broadcasting")
    class Broadcasting {

        @Test
        @DisplayName("sync snapshots go to the sync topic only while sync is enabled")
        void syncTopic() {
            session.enableSync();
            session.recordVisualChange(ChangeEvent.visual("c1", 1000,
                    ChangePayload.NodeModified.of("n1", "label", "A"), "editor"));

            verify(broadcaster, atLeastOnce()).publish(eq("sessions/s1/sync"), eq(WorkflowSession.SYNC_EVENT),
                    any(SyncSnapshot.class));

            session.disableSync();
            clearInvocations(broadcaster);
            session.startExecution("x1", "ws1", "u1", journey());

            verify(broadcaster, never()).publish(eq("sessions/s1/sync"), any(), any());
        }

        @Test
        @DisplayName("execution updates go to the execution topic")
        void executionTopic() {
            session.startExecution("x1", "ws1", "u1", journey());

            verify(broadcaster).publish(eq("sessions/s1/execution"), eq(WorkflowSession.EXECUTION_EVENT),
                    any(ExecutionUpdate.class));
        }

        @Test
        @DisplayName("enabling twice does not double the sync broadcast")
        void enableTwice() {
            session.enableSync();
            session.enableSync();
            clearInvocations(broadcaster);

            session.recordVisualChange(ChangeEvent.visual("c1", 1000,
                    ChangePayload.NodeModified.of("n1", "label", "A"), "editor"));

            verify(broadcaster, times(1))
                    .publish(eq("sessions/s1/sync"), eq(WorkflowSession.SYNC_EVENT), any());
        }
    }

    @Nested
    @DisplayName("execution wiring")
    class Wiring {

        @Test
        @DisplayName("the running step shows as the active block")
        void reflectsProgress() {
            session.startExecution("x1", "ws1", "u1", journey());

            session.handleExecutionEvent(event("e1", "n1", new ExecutionEventDetail.StepStarted(null)));

            assertThat(graph.getExecutionState()).isEqualTo(ExecutionState.RUNNING);
            assertThat(graph.getActiveNodeIds()).containsExactly("n1");
        }

        @Test
        @DisplayName("completion clears the active block")
        void clearsOnCompletion() {
            session.startExecution("x1", "ws1", "u1", journey());
            session.handleExecutionEvent(event("e1", "n1", new ExecutionEventDetail.StepStarted(null)));

            session.handleExecutionEvent(event("e2", null, new ExecutionEventDetail.WorkflowCompleted(null)));

            assertThat(graph.getExecutionState()).isEqualTo(ExecutionState.IDLE);
            assertThat(graph.getActiveNodeIds()).isEmpty();
        }

        @Test
        @DisplayName("a visual edit of the execution state to PAUSED pauses the run")
        void forwardsPause() {
            session.enableSync();
            session.startExecution("x1", "ws1", "u1", journey());
            session.handleExecutionEvent(event("e1", "n1", new ExecutionEventDetail.StepStarted(null)));

            session.recordVisualChange(ChangeEvent.visual("c1", 1000,
                    new ChangePayload.ExecutionStateChanged(ExecutionState.PAUSED), "editor"));

            verify(engine).pause("x1");
            assertThat(session.currentExecution()).map(ExecutionSnapshot::status).contains(ExecutionStatus.PAUSED);
        }

        @Test
        @DisplayName("an execution state edit without an active run reaches no engine")
        void noActiveRun() {
            session.enableSync();

            session.recordVisualChange(ChangeEvent.visual("c1", 1000,
                    new ChangePayload.ExecutionStateChanged(ExecutionState.IDLE), "editor"));

            verify(engine, never()).stop(any());
        }

        @Test
        @DisplayName("a second start while running is refused")
        void secondStart() {
            session.startExecution("x1", "ws1", "u1", journey());

            assertThatThrownBy(() -> session.startExecution("x2", "ws1", "u1", journey()))
                    .isInstanceOf(ExecutionAlreadyActiveException.class);
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("the graph cannot be replaced while sync is enabled")
        void replaceWhileLive() {
            session.enableSync();

            assertThatThrownBy(() -> session.replaceGraph(new WorkflowGraph("wf-1")))
                    .isInstanceOf(GraphMutationException.class);
        }

        @Test
        @DisplayName("an idle session takes a replacement graph in place")
        void replaceWhenIdle() {
            session.replaceGraph(WorkflowGraph.of("wf-1", List.of(WorkflowNode.of("n9", "Wait", "delay")), List.of()));

            assertThat(session.getGraph()).isSameAs(graph);
            assertThat(graph.getNodes()).extracting(WorkflowNode::id).containsExactly("n9");
        }

        @Test
        @DisplayName("closing stops the active run and disables sync")
        void close() {
            session.enableSync();
            session.startExecution("x1", "ws1", "u1", journey());

            session.close();

            verify(engine).stop("x1");
            assertThat(session.currentExecution()).map(ExecutionSnapshot::status).contains(ExecutionStatus.STOPPED);
            assertThat(session.getSyncState().enabled()).isFalse();
        }
    }

    // ── Test Fixtures ──────────────────────────────────────────────

    static WorkflowSessionFactory factory(ExecutionEngine engine, SessionBroadcaster broadcaster) {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        return new WorkflowSessionFactory(new WorkflowStateSnapshotBuilder(),
                new ConflictDetector(SyncProperties.defaults(), clock), new ConflictResolver(),
                SyncProperties.defaults(), engine, new ConversationalMessageFactory(clock),
                new ExecutionLogExporter(objectMapper), mock(ExecutionJournal.class), objectMapper,
                StreamingProperties.defaults(), broadcaster, clock, new SimpleMeterRegistry());
    }

    private static JourneyDefinition journey() {
        return new JourneyDefinition("wf-1", "Fetch and notify", List.of(
                new JourneyDefinition.Step("n1", "Fetch", "http", null),
                new JourneyDefinition.Step("n2", "Notify", "email", null)));
    }

    private static ExecutionEvent event(String eventId, String stepId, ExecutionEventDetail detail) {
        return new ExecutionEvent(eventId, "x1", stepId, null, null, null, detail, null);
    }
}
