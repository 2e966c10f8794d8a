package dev.flowsync.domain.graph;

public record WorkflowEdge(String id, String sourceId, String targetId) {
    public WorkflowEdge {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("edge id required");
    }

    public boolean touches(String nodeId) {
        return nodeId.equals(sourceId) || nodeId.equals(targetId);
    }
}
