package dev.flowsync.sync;

import dev.flowsync.domain.conflict.SyncConflict;
import dev.flowsync.domain.enums.SyncStatus;
import dev.flowsync.domain.representation.WorkflowStateRepresentation;

import java.util.List;

/**
 * Read-only view of a session's synchronization state, handed to subscribers and API callers.
 */
public record SyncSnapshot(
        String sessionId,
        boolean enabled,
        SyncStatus status,
        List<SyncConflict> conflicts,
        WorkflowStateRepresentation representation,
        String lastError
) {
    public SyncSnapshot {
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public static SyncSnapshot disabled(String sessionId) {
        return new SyncSnapshot(sessionId, false, SyncStatus.DISABLED, List.of(), null, null);
    }
}
