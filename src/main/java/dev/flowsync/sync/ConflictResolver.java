package dev.flowsync.sync;

import dev.flowsync.domain.change.ChangeEvent;
import dev.flowsync.domain.conflict.SyncConflict;
import dev.flowsync.domain.enums.ChangeType;
import dev.flowsync.domain.enums.Resolution;
import dev.flowsync.domain.graph.GraphMemento;
import dev.flowsync.domain.graph.WorkflowGraph;
import dev.flowsync.exception.MergeNotPossibleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Applies a user-chosen resolution to a conflict.
 *
 * <p>Work is done on a copy of the graph and committed only when every step succeeds,
 * so a failed resolution leaves both the graph and the conflict untouched.
 *
 * <ul>
 *   <li><b>VISUAL / CHAT</b>: the losing change is rolled back through its memento if
 *       it had been applied, then the winner is applied if it was still pending.</li>
 *   <li><b>MERGE</b>: only for two modifications of the same block with disjoint
 *       fields; the pending half is applied on top of the applied half.</li>
 * </ul>
 */
@Component
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    public Outcome resolve(SyncConflict conflict, Resolution resolution, WorkflowGraph graph,
                           Function<String, GraphMemento> mementos) {
        WorkflowGraph working = graph.copy();
        Map<String, GraphMemento> created = new LinkedHashMap<>();
        ChangeEvent visual = conflict.visualChange();
        ChangeEvent chat = conflict.chatChange();

        switch (resolution) {
            case VISUAL -> {
                chat = discard(chat, working, mementos, "Overridden by the visual change");
                visual = applyIfPending(visual, working, created);
            }
            case CHAT -> {
                visual = discard(visual, working, mementos, "Overridden by the chat change");
                chat = applyIfPending(chat, working, created);
            }
            case MERGE -> {
                if (!mergeable(conflict))
                    throw new MergeNotPossibleException(
                            "Conflict %s cannot be merged: changes are not disjoint modifications of one block"
                                    .formatted(conflict.id()));
                visual = applyIfPending(visual, working, created);
                chat = applyIfPending(chat, working, created);
            }
        }

        graph.replaceWith(working);
        log.debug("Resolved conflict {} with {}: visual={}, chat={}",
                conflict.id(), resolution, visual.status(), chat.status());
        return new Outcome(visual, chat, created);
    }

    public static boolean mergeable(SyncConflict conflict) {
        return conflict.visualChange().type() == ChangeType.NODE_MODIFIED
                && conflict.chatChange().type() == ChangeType.NODE_MODIFIED
                && ConflictDetector.disjointModifications(conflict.visualChange(), conflict.chatChange());
    }

    // ── Internal ───────────────────────────────────────────────────

    private static ChangeEvent discard(ChangeEvent loser, WorkflowGraph working,
                                       Function<String, GraphMemento> mementos, String reason) {
        if (loser.isApplied()) {
            GraphMemento memento = mementos.apply(loser.id());
            if (memento == null)
                throw new IllegalStateException("No rollback record for applied change " + loser.id());
            working.restore(memento);
        }
        return loser.rejected(reason);
    }

    private static ChangeEvent applyIfPending(ChangeEvent change, WorkflowGraph working,
                                              Map<String, GraphMemento> created) {
        if (change.isApplied()) return change;
        created.put(change.id(), working.apply(change.payload()));
        return change.applied();
    }

    /**
     * Final state of both halves plus the mementos for changes applied during resolution.
     */
    public record Outcome(ChangeEvent visualChange, ChangeEvent chatChange, Map<String, GraphMemento> mementos) {
        public Outcome {
            mementos = Map.copyOf(mementos);
        }
    }
}
