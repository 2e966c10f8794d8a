package dev.flowsync.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.flowsync.domain.change.ChangeEvent;
import dev.flowsync.domain.change.ChangePayload;
import dev.flowsync.domain.enums.ChangeSource;
import dev.flowsync.domain.enums.ChangeStatus;
import dev.flowsync.domain.enums.ChangeType;
import dev.flowsync.domain.execution.ExecutionEvent;
import dev.flowsync.domain.execution.ExecutionEventDetail;
import dev.flowsync.domain.execution.JourneyDefinition;
import dev.flowsync.domain.graph.WorkflowGraph;
import dev.flowsync.domain.graph.WorkflowNode;
import dev.flowsync.dto.request.ChangeRequest;
import dev.flowsync.dto.request.EngineEventRequest;
import dev.flowsync.dto.request.OpenSessionRequest;
import dev.flowsync.exception.InvalidChangeEventException;
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

class WireMapperTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private final WireMapper mapper = new WireMapper(objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));

    @Nested
    @DisplayName("change events")
    class Changes {

        @Test
        @DisplayName("data is read into the variant the type names")
        void readsVariant() throws Exception {
            ChangeRequest request = new ChangeRequest("c1", "node_modified", 1500L, "editor",
                    objectMapper.readTree("{\"nodeId\": \"n1\", \"fields\": {\"label\": \"A\"}}"));

            ChangeEvent change = mapper.toChange(request, ChangeSource.VISUAL);

            assertThat(change.type()).isEqualTo(ChangeType.NODE_MODIFIED);
            assertThat(change.timestamp()).isEqualTo(1500L);
            assertThat(change.status()).isEqualTo(ChangeStatus.PENDING);
            assertThat(change.payload()).isEqualTo(ChangePayload.NodeModified.of("n1", "label", "A"));
        }

        @Test
        @DisplayName("a missing timestamp takes the server clock")
        void defaultsTimestamp() throws Exception {
            ChangeRequest request = new ChangeRequest("c1", "EDGE_REMOVED", null, null,
                    objectMapper.readTree("{\"edgeId\": \"e1\"}"));

            assertThat(mapper.toChange(request, ChangeSource.CHAT).timestamp()).isEqualTo(NOW.toEpochMilli());
        }

        @Test
        @DisplayName("unknown types and missing data are invalid changes")
        void invalid() {
            assertThatThrownBy(() -> mapper.toChange(
                    new ChangeRequest("c1", "node_teleported", 1L, null, objectMapper.createObjectNode()),
                    ChangeSource.VISUAL))
                    .isInstanceOf(InvalidChangeEventException.class)
                    .hasMessageContaining("node_teleported");
            assertThatThrownBy(() -> mapper.toChange(
                    new ChangeRequest("c1", "node_added", 1L, null, null), ChangeSource.VISUAL))
                    .isInstanceOf(InvalidChangeEventException.class);
        }
    }

    @Test
    @DisplayName("engine events decode their detail; a missing detail is an empty one")
    void engineEvents() throws Exception {
        ExecutionEvent failed = mapper.toExecutionEvent(new EngineEventRequest("e1", "x1", "step_failed", "a", null,
                null, null, objectMapper.readTree("{\"error\": \"timeout\", \"canRetry\": true}"), null));
        ExecutionEvent paused = mapper.toExecutionEvent(new EngineEventRequest("e2", "x1", "WORKFLOW_PAUSED", null,
                null, null, null, null, null));

        assertThat(failed.detail()).isEqualTo(new ExecutionEventDetail.StepFailed("timeout", true, false, false));
        assertThat(failed.timestamp()).isEqualTo(NOW);
        assertThat(paused.detail()).isInstanceOf(ExecutionEventDetail.WorkflowPaused.class);
        assertThatThrownBy(() -> mapper.toExecutionEvent(new EngineEventRequest("e3", "x1", "exploded", null,
                null, null, null, null, null)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("graphs and journeys")
    class Graphs {

        @Test
        @DisplayName("blocks default to enabled and the workflow id to the session id")
        void graph() {
            WorkflowGraph graph = mapper.toGraph("s1", new OpenSessionRequest(null,
                    List.of(new OpenSessionRequest.Block("n1", "Fetch", "http", null, null, Map.of("url", "x")),
                            new OpenSessionRequest.Block("n2", null, "email", null, false, null)),
                    List.of(new OpenSessionRequest.Connection("e1", "n1", "n2"))));

            assertThat(graph.getWorkflowId()).isEqualTo("s1");
            assertThat(graph.getNodes()).extracting(WorkflowNode::enabled).containsExactly(true, false);
            assertThat(graph.edgeCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("a connection to a missing block is a bad request")
        void danglingEdge() {
            assertThatThrownBy(() -> mapper.toGraph("s1", new OpenSessionRequest("wf",
                    List.of(new OpenSessionRequest.Block("n1", null, "http", null, null, null)),
                    List.of(new OpenSessionRequest.Connection("e1", "n1", "ghost")))))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("without a posted journey the enabled blocks become the steps")
        void journeyFromGraph() {
            WorkflowGraph graph = WorkflowGraph.of("wf", List.of(
                    WorkflowNode.of("n1", "Fetch", "http"),
                    new WorkflowNode("n2", "Off", "email", null, false, null),
                    WorkflowNode.of("n3", "Store", "db")), List.of());

            JourneyDefinition journey = mapper.toJourney(null, graph);

            assertThat(journey.steps()).extracting(JourneyDefinition.Step::id).containsExactly("n1", "n3");
        }
    }
}
