package dev.flowsync.domain.graph;

import dev.flowsync.domain.change.ChangePayload;
import dev.flowsync.domain.enums.ExecutionState;
import dev.flowsync.exception.GraphMutationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical, mutable workflow graph for one session. Owned by the session's
 * synchronizer and only touched from the session lane.
 *
 * <p>Insertion order of nodes and edges is preserved; it is the display order of
 * the chat representation and the step order of journeys derived from the graph.
 */
public class WorkflowGraph {

    private final String workflowId;
    private final Map<String, WorkflowNode> nodes = new LinkedHashMap<>();
    private final Map<String, WorkflowEdge> edges = new LinkedHashMap<>();
    private final Set<String> activeNodeIds = new LinkedHashSet<>();
    private ExecutionState executionState = ExecutionState.IDLE;

    public WorkflowGraph(String workflowId) {
        this.workflowId = workflowId;
    }

    public static WorkflowGraph of(String workflowId, Collection<WorkflowNode> nodes, Collection<WorkflowEdge> edges) {
        WorkflowGraph graph = new WorkflowGraph(workflowId);
        nodes.forEach(n -> graph.nodes.put(n.id(), n));
        for (WorkflowEdge edge : edges) {
            graph.requireEndpoints(edge.sourceId(), edge.targetId());
            graph.edges.put(edge.id(), edge);
        }
        return graph;
    }

    /**
     * Applies the payload and returns the memento that undoes it.
     *
     * @throws GraphMutationException when the payload does not fit the current graph
     */
    public GraphMemento apply(ChangePayload payload) {
        if (payload instanceof ChangePayload.NodeAdded added) {
            if (nodes.containsKey(added.nodeId()))
                throw new GraphMutationException("Node already exists: " + added.nodeId());
            nodes.put(added.nodeId(), new WorkflowNode(added.nodeId(), added.name(), added.blockType(),
                    added.description(), true, Map.of()));
            return memento(payload, null, null, List.of());
        }
        if (payload instanceof ChangePayload.NodeRemoved removed) {
            WorkflowNode previous = requireNode(removed.nodeId());
            List<WorkflowEdge> connected = edges.values().stream()
                    .filter(e -> e.touches(removed.nodeId()))
                    .toList();
            connected.forEach(e -> edges.remove(e.id()));
            nodes.remove(removed.nodeId());
            activeNodeIds.remove(removed.nodeId());
            return memento(payload, previous, null, connected);
        }
        if (payload instanceof ChangePayload.NodeModified modified) {
            WorkflowNode previous = requireNode(modified.nodeId());
            nodes.put(previous.id(), previous.withFields(modified.fields()));
            return memento(payload, previous, null, List.of());
        }
        if (payload instanceof ChangePayload.EdgeAdded added) {
            if (edges.containsKey(added.edgeId()))
                throw new GraphMutationException("Connection already exists: " + added.edgeId());
            requireEndpoints(added.sourceNodeId(), added.targetNodeId());
            edges.put(added.edgeId(), new WorkflowEdge(added.edgeId(), added.sourceNodeId(), added.targetNodeId()));
            return memento(payload, null, null, List.of());
        }
        if (payload instanceof ChangePayload.EdgeRemoved removed) {
            WorkflowEdge previous = edges.remove(removed.edgeId());
            if (previous == null) throw new GraphMutationException("Connection not found: " + removed.edgeId());
            return memento(payload, null, previous, List.of());
        }
        if (payload instanceof ChangePayload.ExecutionStateChanged changed) {
            ExecutionState previous = executionState;
            executionState = changed.state();
            return new GraphMemento(payload.type(), payload.targetId(), null, null, List.of(), previous);
        }
        throw new IllegalArgumentException("Unsupported payload: " + payload.getClass().getName());
    }

    /** Reverts the entity captured by the memento. */
    public void restore(GraphMemento memento) {
        switch (memento.changeType()) {
            case NODE_ADDED -> {
                nodes.remove(memento.entityId());
                edges.values().removeIf(e -> e.touches(memento.entityId()));
                activeNodeIds.remove(memento.entityId());
            }
            case NODE_REMOVED -> {
                nodes.put(memento.entityId(), memento.previousNode());
                memento.removedEdges().stream()
                        .filter(e -> nodes.containsKey(e.sourceId()) && nodes.containsKey(e.targetId()))
                        .forEach(e -> edges.putIfAbsent(e.id(), e));
            }
            case NODE_MODIFIED -> {
                if (nodes.containsKey(memento.entityId())) nodes.put(memento.entityId(), memento.previousNode());
            }
            case EDGE_ADDED -> edges.remove(memento.entityId());
            case EDGE_REMOVED -> {
                WorkflowEdge edge = memento.previousEdge();
                if (nodes.containsKey(edge.sourceId()) && nodes.containsKey(edge.targetId()))
                    edges.putIfAbsent(edge.id(), edge);
            }
            case EXECUTION_STATE_CHANGED -> executionState = memento.previousExecutionState();
        }
    }

    public WorkflowGraph copy() {
        WorkflowGraph copy = new WorkflowGraph(workflowId);
        copy.nodes.putAll(nodes);
        copy.edges.putAll(edges);
        copy.activeNodeIds.addAll(activeNodeIds);
        copy.executionState = executionState;
        return copy;
    }

    /** Replaces this graph's content with {@code other}'s. */
    public void replaceWith(WorkflowGraph other) {
        nodes.clear();
        nodes.putAll(other.nodes);
        edges.clear();
        edges.putAll(other.edges);
        activeNodeIds.clear();
        activeNodeIds.addAll(other.activeNodeIds);
        executionState = other.executionState;
    }

    /**
     * Reflects execution progress reported by the streamer. Not a change event:
     * the chat and visual sides never edit these directly.
     */
    public void reflectExecution(ExecutionState state, Collection<String> activeIds) {
        this.executionState = state;
        activeNodeIds.clear();
        activeIds.stream().filter(nodes::containsKey).forEach(activeNodeIds::add);
    }

    public Optional<WorkflowNode> findNode(String identifier) {
        WorkflowNode byId = nodes.get(identifier);
        if (byId != null) return Optional.of(byId);
        return nodes.values().stream().filter(n -> n.matches(identifier)).findFirst();
    }

    public Optional<WorkflowEdge> findEdgeBetween(String sourceId, String targetId) {
        return edges.values().stream()
                .filter(e -> e.sourceId().equals(sourceId) && e.targetId().equals(targetId))
                .findFirst();
    }

    // Read-only views

    public String getWorkflowId() { return workflowId; }

    public Collection<WorkflowNode> getNodes() { return Collections.unmodifiableCollection(nodes.values()); }

    public Collection<WorkflowEdge> getEdges() { return Collections.unmodifiableCollection(edges.values()); }

    public Optional<WorkflowNode> getNode(String id) { return Optional.ofNullable(nodes.get(id)); }

    public Set<String> getActiveNodeIds() { return Collections.unmodifiableSet(activeNodeIds); }

    public ExecutionState getExecutionState() { return executionState; }

    public int nodeCount() { return nodes.size(); }

    public int edgeCount() { return edges.size(); }

    // ── Internal ───────────────────────────────────────────────────

    private WorkflowNode requireNode(String nodeId) {
        WorkflowNode node = nodes.get(nodeId);
        if (node == null) throw new GraphMutationException("Block not found: " + nodeId);
        return node;
    }

    private void requireEndpoints(String sourceId, String targetId) {
        if (!nodes.containsKey(sourceId)) throw new GraphMutationException("Source block not found: " + sourceId);
        if (!nodes.containsKey(targetId)) throw new GraphMutationException("Target block not found: " + targetId);
    }

    private static GraphMemento memento(ChangePayload payload, WorkflowNode previousNode,
                                        WorkflowEdge previousEdge, List<WorkflowEdge> removedEdges) {
        return new GraphMemento(payload.type(), payload.targetId(), previousNode, previousEdge,
                new ArrayList<>(removedEdges), null);
    }
}
