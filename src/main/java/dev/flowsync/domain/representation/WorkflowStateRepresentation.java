package dev.flowsync.domain.representation;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.flowsync.domain.enums.ExecutionState;

import java.util.List;

/**
 * Chat-facing view of a workflow graph. Immutable; a new instance replaces the previous
 * one after every applied change.
 */
public record WorkflowStateRepresentation(
        String workflowId,
        String summary,
        List<BlockSummary> blockSummaries,
        List<ConnectionSummary> connectionSummaries,
        ExecutionState executionState
) {
    public WorkflowStateRepresentation {
        blockSummaries = blockSummaries == null ? List.of() : List.copyOf(blockSummaries);
        connectionSummaries = connectionSummaries == null ? List.of() : List.copyOf(connectionSummaries);
        if (executionState == null) executionState = ExecutionState.IDLE;
    }

    public static WorkflowStateRepresentation empty(String workflowId) {
        return new WorkflowStateRepresentation(workflowId, "Workflow with 0 blocks and 0 connections",
                List.of(), List.of(), ExecutionState.IDLE);
    }

    public record BlockSummary(
            String id,
            String name,
            String type,
            String description,
            @JsonProperty("isActive") boolean active,
            @JsonProperty("isEnabled") boolean enabled
    ) {}

    public record ConnectionSummary(String id, String description) {}
}
