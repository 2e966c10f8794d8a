package dev.flowsync.sync;

import dev.flowsync.domain.graph.WorkflowEdge;
import dev.flowsync.domain.graph.WorkflowGraph;
import dev.flowsync.domain.graph.WorkflowNode;
import dev.flowsync.domain.representation.WorkflowStateRepresentation;
import dev.flowsync.domain.representation.WorkflowStateRepresentation.BlockSummary;
import dev.flowsync.domain.representation.WorkflowStateRepresentation.ConnectionSummary;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Builds the chat-facing representation of a workflow graph.
 *
 * <p>Pure and linear in nodes plus edges. The result shares no mutable state with
 * the graph; every list is copied into the immutable record.
 */
@Component
public class WorkflowStateSnapshotBuilder {

    public WorkflowStateRepresentation build(WorkflowGraph graph) {
        Set<String> active = graph.getActiveNodeIds();
        List<BlockSummary> blocks = new ArrayList<>(graph.nodeCount());
        for (WorkflowNode node : graph.getNodes()) {
            blocks.add(new BlockSummary(node.id(), node.name(), node.type(), node.description(),
                    active.contains(node.id()), node.enabled()));
        }

        List<ConnectionSummary> connections = new ArrayList<>(graph.edgeCount());
        for (WorkflowEdge edge : graph.getEdges()) {
            connections.add(new ConnectionSummary(edge.id(),
                    displayName(graph, edge.sourceId()) + " → " + displayName(graph, edge.targetId())));
        }

        String summary = "Workflow with %d blocks and %d connections".formatted(blocks.size(), connections.size());
        return new WorkflowStateRepresentation(graph.getWorkflowId(), summary, blocks, connections,
                graph.getExecutionState());
    }

    private static String displayName(WorkflowGraph graph, String nodeId) {
        return graph.getNode(nodeId).map(WorkflowNode::name).orElse(nodeId);
    }
}
