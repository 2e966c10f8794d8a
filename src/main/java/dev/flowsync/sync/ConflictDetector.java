package dev.flowsync.sync;

import dev.flowsync.config.SyncProperties;
import dev.flowsync.domain.change.ChangeEvent;
import dev.flowsync.domain.change.ChangePayload;
import dev.flowsync.domain.conflict.SyncConflict;
import dev.flowsync.domain.enums.ChangeSource;
import dev.flowsync.domain.enums.ChangeType;
import dev.flowsync.domain.enums.ConflictType;
import dev.flowsync.domain.enums.Resolution;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Decides whether two changes from opposite sources are concurrent and, if so,
 * classifies the conflict.
 *
 * <p>Concurrent means the timestamps are at most {@code conflictWindow} apart and the
 * changes share a target: the same node or edge id, the execution state, or a node
 * removal paired with a connection that references the removed node.
 *
 * <p>Classification is first-match:
 * <ol>
 *   <li>same node, at least one modification: {@link ConflictType#CONCURRENT_BLOCK_MODIFICATION}</li>
 *   <li>same edge: {@link ConflictType#CONCURRENT_CONNECTION_CHANGE}</li>
 *   <li>either is an execution-state change: {@link ConflictType#EXECUTION_STATE_CONFLICT}</li>
 *   <li>anything else: {@link ConflictType#STRUCTURAL_CONFLICT}</li>
 * </ol>
 * Classification and the suggested resolution depend only on the two changes, so the
 * same pair always yields the same verdict.
 */
@Component
public class ConflictDetector {

    private final Duration window;
    private final Clock clock;

    public ConflictDetector(SyncProperties properties, Clock clock) {
        this.window = properties.conflictWindow();
        this.clock = clock;
    }

    public Duration window() {
        return window;
    }

    public boolean withinWindow(ChangeEvent a, ChangeEvent b) {
        return Math.abs(a.timestamp() - b.timestamp()) <= window.toMillis();
    }

    public Optional<SyncConflict> detect(ChangeEvent incoming, ChangeEvent other) {
        if (incoming.source() == other.source())
            throw new IllegalArgumentException("Conflict detection requires changes from opposite sources");
        if (!withinWindow(incoming, other) || !sharesTarget(incoming, other)) return Optional.empty();

        ChangeEvent visual = incoming.source() == ChangeSource.VISUAL ? incoming : other;
        ChangeEvent chat = incoming.source() == ChangeSource.CHAT ? incoming : other;
        ConflictType type = classify(visual, chat);
        return Optional.of(new SyncConflict(
                UUID.randomUUID().toString(),
                type,
                clock.millis(),
                describe(type, visual, chat),
                visual,
                chat,
                chat.timestamp() > visual.timestamp() ? Resolution.CHAT : Resolution.VISUAL,
                type == ConflictType.CONCURRENT_BLOCK_MODIFICATION && disjointModifications(visual, chat)));
    }

    /** True when both changes modify the same node and touch no common field. */
    public static boolean disjointModifications(ChangeEvent a, ChangeEvent b) {
        if (!(a.payload() instanceof ChangePayload.NodeModified left)
                || !(b.payload() instanceof ChangePayload.NodeModified right)) return false;
        return left.nodeId().equals(right.nodeId()) && !left.touchesAny(right.fields().keySet());
    }

    // ── Internal ───────────────────────────────────────────────────

    private static boolean sharesTarget(ChangeEvent a, ChangeEvent b) {
        if (a.type() == ChangeType.EXECUTION_STATE_CHANGED || b.type() == ChangeType.EXECUTION_STATE_CHANGED)
            return a.type() == b.type();
        if (sameEntity(a, b)) return true;
        return removesReferencedNode(a, b) || removesReferencedNode(b, a);
    }

    private static boolean sameEntity(ChangeEvent a, ChangeEvent b) {
        return a.type().isEdgeChange() == b.type().isEdgeChange() && a.targetId().equals(b.targetId());
    }

    private static boolean removesReferencedNode(ChangeEvent removal, ChangeEvent dependent) {
        return removal.type() == ChangeType.NODE_REMOVED
                && dependent.payload().referencedNodeIds().contains(removal.targetId());
    }

    private static ConflictType classify(ChangeEvent visual, ChangeEvent chat) {
        boolean sameEntity = sameEntity(visual, chat);
        if (sameEntity && visual.type().isNodeChange()
                && (visual.type() == ChangeType.NODE_MODIFIED || chat.type() == ChangeType.NODE_MODIFIED))
            return ConflictType.CONCURRENT_BLOCK_MODIFICATION;
        if (sameEntity && visual.type().isEdgeChange())
            return ConflictType.CONCURRENT_CONNECTION_CHANGE;
        if (visual.type() == ChangeType.EXECUTION_STATE_CHANGED || chat.type() == ChangeType.EXECUTION_STATE_CHANGED)
            return ConflictType.EXECUTION_STATE_CONFLICT;
        return ConflictType.STRUCTURAL_CONFLICT;
    }

    private static String describe(ConflictType type, ChangeEvent visual, ChangeEvent chat) {
        return switch (type) {
            case CONCURRENT_BLOCK_MODIFICATION -> "Block %s was changed in the editor (%s) and in chat (%s)"
                    .formatted(visual.targetId(), visual.type(), chat.type());
            case CONCURRENT_CONNECTION_CHANGE -> "Connection %s was changed in the editor (%s) and in chat (%s)"
                    .formatted(visual.targetId(), visual.type(), chat.type());
            case EXECUTION_STATE_CONFLICT -> "Execution state was set to %s in the editor and %s in chat"
                    .formatted(stateOf(visual), stateOf(chat));
            case STRUCTURAL_CONFLICT -> "Editor %s on %s overlaps chat %s on %s"
                    .formatted(visual.type(), visual.targetId(), chat.type(), chat.targetId());
        };
    }

    private static String stateOf(ChangeEvent change) {
        return change.payload() instanceof ChangePayload.ExecutionStateChanged changed
                ? changed.state().name()
                : change.type().name();
    }
}
