package dev.flowsync.sync;

import dev.flowsync.domain.change.ChangeEvent;
import dev.flowsync.domain.conflict.SyncConflict;

/**
 * Result of recording one change: the change in its final status and the conflict it
 * raised, if any. A conflicted change stays PENDING until the conflict is resolved.
 */
public record ChangeOutcome(ChangeEvent change, SyncConflict conflict, SyncSnapshot state) {

    public boolean conflicted() {
        return conflict != null;
    }
}
