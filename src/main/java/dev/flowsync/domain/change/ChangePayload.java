package dev.flowsync.domain.change;

import dev.flowsync.domain.enums.ChangeType;
import dev.flowsync.domain.enums.ExecutionState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Typed description of a single graph mutation. One variant per {@link ChangeType};
 * the variant's fields are everything needed to apply it.
 */
public interface ChangePayload {

    /** Shared target for all execution-state changes. */
    String EXECUTION_TARGET = "__execution__";

    ChangeType type();

    /** Node id, edge id or {@link #EXECUTION_TARGET}. */
    String targetId();

    boolean hasRequiredFields();

    /** Nodes this change depends on without targeting them directly. */
    default Set<String> referencedNodeIds() {
        return Set.of();
    }

    static Class<? extends ChangePayload> variantOf(ChangeType type) {
        return switch (type) {
            case NODE_ADDED -> NodeAdded.class;
            case NODE_REMOVED -> NodeRemoved.class;
            case NODE_MODIFIED -> NodeModified.class;
            case EDGE_ADDED -> EdgeAdded.class;
            case EDGE_REMOVED -> EdgeRemoved.class;
            case EXECUTION_STATE_CHANGED -> ExecutionStateChanged.class;
        };
    }

    record NodeAdded(String nodeId, String name, String blockType, String description) implements ChangePayload {
        @Override public ChangeType type() { return ChangeType.NODE_ADDED; }
        @Override public String targetId() { return nodeId; }
        @Override public boolean hasRequiredFields() { return notBlank(nodeId) && notBlank(blockType); }
    }

    record NodeRemoved(String nodeId) implements ChangePayload {
        @Override public ChangeType type() { return ChangeType.NODE_REMOVED; }
        @Override public String targetId() { return nodeId; }
        @Override public boolean hasRequiredFields() { return notBlank(nodeId); }
    }

    /**
     * Field-level modification. Field order is kept; values may be null (clears the field).
     */
    record NodeModified(String nodeId, Map<String, Object> fields) implements ChangePayload {
        public NodeModified {
            fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        public static NodeModified of(String nodeId, String field, Object value) {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put(field, value);
            return new NodeModified(nodeId, fields);
        }

        @Override public ChangeType type() { return ChangeType.NODE_MODIFIED; }
        @Override public String targetId() { return nodeId; }
        @Override public boolean hasRequiredFields() { return notBlank(nodeId) && !fields.isEmpty(); }

        public boolean touchesAny(Set<String> otherFields) {
            return fields.keySet().stream().anyMatch(otherFields::contains);
        }
    }

    record EdgeAdded(String edgeId, String sourceNodeId, String targetNodeId) implements ChangePayload {
        @Override public ChangeType type() { return ChangeType.EDGE_ADDED; }
        @Override public String targetId() { return edgeId; }
        @Override public boolean hasRequiredFields() {
            return notBlank(edgeId) && notBlank(sourceNodeId) && notBlank(targetNodeId);
        }
        @Override public Set<String> referencedNodeIds() {
            return sourceNodeId.equals(targetNodeId) ? Set.of(sourceNodeId) : Set.of(sourceNodeId, targetNodeId);
        }
    }

    record EdgeRemoved(String edgeId) implements ChangePayload {
        @Override public ChangeType type() { return ChangeType.EDGE_REMOVED; }
        @Override public String targetId() { return edgeId; }
        @Override public boolean hasRequiredFields() { return notBlank(edgeId); }
    }

    record ExecutionStateChanged(ExecutionState state) implements ChangePayload {
        @Override public ChangeType type() { return ChangeType.EXECUTION_STATE_CHANGED; }
        @Override public String targetId() { return EXECUTION_TARGET; }
        @Override public boolean hasRequiredFields() { return state != null; }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
