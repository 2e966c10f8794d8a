package dev.flowsync.domain.enums;

import java.util.Locale;

public enum ChangeType {
    NODE_ADDED(true, false),
    NODE_REMOVED(true, false),
    NODE_MODIFIED(false, false),
    EDGE_ADDED(true, true),
    EDGE_REMOVED(true, true),
    EXECUTION_STATE_CHANGED(false, false);

    private final boolean topological;
    private final boolean edgeChange;

    ChangeType(boolean topological, boolean edgeChange) {
        this.topological = topological;
        this.edgeChange = edgeChange;
    }

    /** True for additions and removals, which alter the shape of the graph. */
    public boolean isTopological() { return topological; }

    public boolean isEdgeChange() { return edgeChange; }

    public boolean isNodeChange() {
        return this == NODE_ADDED || this == NODE_REMOVED || this == NODE_MODIFIED;
    }

    /** Accepts both {@code node_added} and {@code NODE_ADDED}. */
    public static ChangeType fromWire(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
