package dev.flowsync.domain.graph;

import dev.flowsync.domain.enums.ChangeType;
import dev.flowsync.domain.enums.ExecutionState;

import java.util.List;

/**
 * Entity-level undo record captured when a change is applied. Restoring it reverts
 * only the entity the change touched, leaving unrelated later changes in place.
 */
public record GraphMemento(
        ChangeType changeType,
        String entityId,
        WorkflowNode previousNode,
        WorkflowEdge previousEdge,
        List<WorkflowEdge> removedEdges,
        ExecutionState previousExecutionState
) {
    public GraphMemento {
        removedEdges = removedEdges == null ? List.of() : List.copyOf(removedEdges);
    }
}
