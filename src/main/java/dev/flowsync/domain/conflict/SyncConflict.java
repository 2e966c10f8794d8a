package dev.flowsync.domain.conflict;

import dev.flowsync.domain.change.ChangeEvent;
import dev.flowsync.domain.enums.ConflictType;
import dev.flowsync.domain.enums.Resolution;

/**
 * A pair of concurrent changes from opposite sources that touch the same entity
 * or the same global concern. Always holds one VISUAL and one CHAT change.
 */
public record SyncConflict(
        String id,
        ConflictType type,
        long timestamp,
        String description,
        ChangeEvent visualChange,
        ChangeEvent chatChange,
        Resolution suggestedResolution,
        boolean autoResolvable
) {
    /** The change that was already applied when the conflict was raised, if any. */
    public ChangeEvent appliedHalf() {
        if (visualChange.isApplied()) return visualChange;
        if (chatChange.isApplied()) return chatChange;
        return null;
    }

    /** This conflict with whichever half shares {@code updated}'s id replaced by it. */
    public SyncConflict withChange(ChangeEvent updated) {
        if (visualChange.id().equals(updated.id()))
            return new SyncConflict(id, type, timestamp, description, updated, chatChange, suggestedResolution,
                    autoResolvable);
        if (chatChange.id().equals(updated.id()))
            return new SyncConflict(id, type, timestamp, description, visualChange, updated, suggestedResolution,
                    autoResolvable);
        return this;
    }
}
