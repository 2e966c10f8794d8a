package dev.flowsync.sync;

import dev.flowsync.domain.change.ChangePayload;
import dev.flowsync.domain.enums.ExecutionState;
import dev.flowsync.domain.graph.WorkflowEdge;
import dev.flowsync.domain.graph.WorkflowGraph;
import dev.flowsync.domain.graph.WorkflowNode;
import dev.flowsync.domain.representation.WorkflowStateRepresentation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WorkflowStateSnapshotBuilderTest {

    private final WorkflowStateSnapshotBuilder builder = new WorkflowStateSnapshotBuilder();

    @Test
    @DisplayName("summarizes blocks and connections in graph order")
    void buildsRepresentation() {
        WorkflowGraph graph = WorkflowGraph.of("wf-1",
                List.of(WorkflowNode.of("n1", "Fetch orders", "http"),
                        new WorkflowNode("n2", null, "email", "Send digest", false, Map.of())),
                List.of(new WorkflowEdge("e1", "n1", "n2")));
        graph.reflectExecution(ExecutionState.RUNNING, List.of("n1"));

        WorkflowStateRepresentation representation = builder.build(graph);

        assertThat(representation.summary()).isEqualTo("Workflow with 2 blocks and 1 connections");
        assertThat(representation.executionState()).isEqualTo(ExecutionState.RUNNING);
        assertThat(representation.blockSummaries()).extracting(WorkflowStateRepresentation.BlockSummary::name)
                .containsExactly("Fetch orders", "Email");
        assertThat(representation.blockSummaries().get(0).active()).isTrue();
        assertThat(representation.blockSummaries().get(1).enabled()).isFalse();
        assertThat(representation.connectionSummaries()).singleElement()
                .extracting(WorkflowStateRepresentation.ConnectionSummary::description)
                .isEqualTo("Fetch orders → Email");
    }

    @Test
    @DisplayName("later graph edits do not leak into an earlier representation")
    void representationIsDetached() {
        WorkflowGraph graph = WorkflowGraph.of("wf-1", List.of(WorkflowNode.of("n1", "A", "http")), List.of());
        WorkflowStateRepresentation before = builder.build(graph);

        graph.apply(new ChangePayload.NodeAdded("n2", "B", "http", null));

        assertThat(before.blockSummaries()).hasSize(1);
        assertThat(builder.build(graph).blockSummaries()).hasSize(2);
    }
}
