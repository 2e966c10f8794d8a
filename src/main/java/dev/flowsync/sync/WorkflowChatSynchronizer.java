package dev.flowsync.sync;

import dev.flowsync.config.SyncProperties;
import dev.flowsync.domain.change.ChangeEvent;
import dev.flowsync.domain.conflict.ConflictStats;
import dev.flowsync.domain.conflict.SyncConflict;
import dev.flowsync.domain.enums.ChangeSource;
import dev.flowsync.domain.enums.ExecutionState;
import dev.flowsync.domain.enums.Resolution;
import dev.flowsync.domain.enums.SyncStatus;
import dev.flowsync.domain.graph.GraphMemento;
import dev.flowsync.domain.graph.WorkflowGraph;
import dev.flowsync.domain.representation.WorkflowStateRepresentation;
import dev.flowsync.exception.ConflictNotFoundException;
import dev.flowsync.exception.GraphMutationException;
import dev.flowsync.exception.SyncNotEnabledException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Keeps one session's workflow graph and its chat representation consistent while the
 * visual editor and the chat both mutate it.
 *
 * <p>Lifecycle:
 * <pre>
 * DISABLED → IDLE ⇄ SYNCING → IDLE | CONFLICT
 * IDLE | SYNCING | CONFLICT → ERROR (recoverable) → IDLE
 * </pre>
 *
 * <p>Design decisions:
 * <ul>
 *   <li><b>Not thread-safe</b>: every call for a session runs on that session's lane,
 *       so no two changes or resolutions for the same graph interleave.</li>
 *   <li><b>Two-phase apply</b>: a change is PENDING until the detector has compared it
 *       with the newest overlapping change from the other source. Without a conflict it
 *       is applied and becomes APPLIED; a conflicted change stays PENDING inside the
 *       conflict; a change the graph refuses becomes REJECTED.</li>
 *   <li><b>Entity-level rollback</b>: every applied change leaves a memento so a later
 *       resolution can undo just that entity.</li>
 *   <li><b>Status is derived</b>: after every operation the status is recomputed from
 *       the conflict list and the last error, so CONFLICT holds exactly when conflicts
 *       are pending.</li>
 *   <li><b>Synchronous delivery</b>: subscribers are called in registration order on the
 *       calling thread and receive immutable snapshots.</li>
 * </ul>
 */
public class WorkflowChatSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(WorkflowChatSynchronizer.class);

    private final String sessionId;
    private final WorkflowGraph graph;
    private final WorkflowStateSnapshotBuilder snapshotBuilder;
    private final ConflictDetector detector;
    private final ConflictResolver resolver;
    private final SyncProperties properties;
    private final MeterRegistry meterRegistry;
    private final Timer applyTimer;

    private final List<Consumer<SyncSnapshot>> subscribers = new CopyOnWriteArrayList<>();
    private final List<ChangeApplicationListener> applicationListeners = new CopyOnWriteArrayList<>();
    private final ConflictStats.Tracker stats = new ConflictStats.Tracker();

    private boolean enabled;
    private SyncStatus status = SyncStatus.DISABLED;
    private final Map<String, SyncConflict> conflicts = new LinkedHashMap<>();
    private final Map<ChangeSource, Deque<ChangeEvent>> recent = new EnumMap<>(ChangeSource.class);
    private final Map<String, GraphMemento> mementos = new HashMap<>();
    private WorkflowStateRepresentation representation;
    private String lastError;

    public WorkflowChatSynchronizer(String sessionId,
                                    WorkflowGraph graph,
                                    WorkflowStateSnapshotBuilder snapshotBuilder,
                                    ConflictDetector detector,
                                    ConflictResolver resolver,
                                    SyncProperties properties,
                                    MeterRegistry meterRegistry) {
        this.sessionId = sessionId;
        this.graph = graph;
        this.snapshotBuilder = snapshotBuilder;
        this.detector = detector;
        this.resolver = resolver;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.applyTimer = Timer.builder("flowsync.sync.apply.duration")
                .description("Time to detect, apply and republish one change")
                .register(meterRegistry);
        recent.put(ChangeSource.VISUAL, new ArrayDeque<>());
        recent.put(ChangeSource.CHAT, new ArrayDeque<>());
    }

    /** Starts synchronization. Calling it again while enabled only returns the current state. */
    public SyncSnapshot enableSync() {
        if (enabled) return snapshot();
        enabled = true;
        status = SyncStatus.IDLE;
        representation = snapshotBuilder.build(graph);
        log.info("Sync enabled for session {}: {}", sessionId, representation.summary());
        publish();
        return snapshot();
    }

    /**
     * Stops synchronization, dropping pending conflicts unresolved. Subscribers get a final
     * DISABLED snapshot and are then unregistered before this method returns.
     */
    public SyncSnapshot disableSync() {
        if (!enabled && subscribers.isEmpty()) return snapshot();
        int dropped = conflicts.size();
        enabled = false;
        status = SyncStatus.DISABLED;
        conflicts.clear();
        recent.values().forEach(Deque::clear);
        mementos.clear();
        representation = null;
        lastError = null;
        stats.reset();
        publish();
        subscribers.clear();
        log.info("Sync disabled for session {} ({} pending conflicts discarded)", sessionId, dropped);
        return snapshot();
    }

    public ChangeOutcome recordVisualChange(ChangeEvent change) {
        return record(change, ChangeSource.VISUAL);
    }

    public ChangeOutcome recordChatChange(ChangeEvent change) {
        return record(change, ChangeSource.CHAT);
    }

    /**
     * Resolves a pending conflict. On {@link dev.flowsync.exception.MergeNotPossibleException}
     * or a graph refusal the conflict stays queued and nothing changes.
     */
    public SyncSnapshot resolveConflict(String conflictId, Resolution resolution) {
        requireEnabled();
        SyncConflict conflict = conflicts.get(conflictId);
        if (conflict == null) throw new ConflictNotFoundException(conflictId);

        ConflictResolver.Outcome outcome = resolver.resolve(conflict, resolution, graph, mementos::get);
        conflicts.remove(conflictId);
        mementos.putAll(outcome.mementos());
        propagate(outcome.visualChange());
        propagate(outcome.chatChange());
        settleWindow(conflict.visualChange(), outcome.visualChange());
        settleWindow(conflict.chatChange(), outcome.chatChange());
        stats.resolved(resolution);
        Counter.builder("flowsync.sync.resolutions")
                .tag("strategy", resolution.name())
                .register(meterRegistry)
                .increment();
        log.info("Session {}: conflict {} ({}) resolved with {}", sessionId, conflictId, conflict.type(), resolution);

        refresh();
        notifyApplied(conflict.visualChange(), outcome.visualChange());
        notifyApplied(conflict.chatChange(), outcome.chatChange());
        return snapshot();
    }

    public Subscription subscribe(Consumer<SyncSnapshot> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    public Subscription onChangeApplied(ChangeApplicationListener listener) {
        applicationListeners.add(listener);
        return () -> applicationListeners.remove(listener);
    }

    /**
     * Mirrors execution progress into the graph. This is not a change event: it cannot
     * conflict and is not part of either source's window.
     */
    public void reflectExecutionProgress(ExecutionState state, Collection<String> activeNodeIds) {
        graph.reflectExecution(state, activeNodeIds);
        if (enabled) {
            representation = snapshotBuilder.build(graph);
            publish();
        }
    }

    public SyncSnapshot snapshot() {
        return new SyncSnapshot(sessionId, enabled, status, new ArrayList<>(conflicts.values()),
                representation, lastError);
    }

    public ConflictStats conflictStats() {
        return stats.snapshot(conflicts.size());
    }

    public Optional<SyncConflict> findConflict(String conflictId) {
        return Optional.ofNullable(conflicts.get(conflictId));
    }

    public boolean isEnabled() { return enabled; }

    public SyncStatus getStatus() { return status; }

    public List<SyncConflict> getConflicts() { return List.copyOf(conflicts.values()); }

    public WorkflowStateRepresentation getRepresentation() { return representation; }

    public WorkflowGraph getGraph() { return graph; }

    // ── Internal ───────────────────────────────────────────────────

    private ChangeOutcome record(ChangeEvent change, ChangeSource source) {
        ChangeValidator.validate(change, source);
        requireEnabled();

        Timer.Sample sample = Timer.start(meterRegistry);
        status = SyncStatus.SYNCING;
        try {
            Optional<SyncConflict> conflict = findConcurrent(change);
            if (conflict.isPresent()) {
                return raise(conflict.get());
            }
            return apply(change);
        } finally {
            settle();
            sample.stop(applyTimer);
        }
    }

    /** Newest overlapping change from the other source wins the comparison. */
    private Optional<SyncConflict> findConcurrent(ChangeEvent change) {
        Iterator<ChangeEvent> newestFirst = recent.get(change.source().opposite()).descendingIterator();
        while (newestFirst.hasNext()) {
            ChangeEvent other = newestFirst.next();
            if (!detector.withinWindow(change, other)) continue;
            Optional<SyncConflict> conflict = detector.detect(change, other);
            if (conflict.isPresent()) return conflict;
        }
        return Optional.empty();
    }

    private ChangeOutcome raise(SyncConflict conflict) {
        conflicts.put(conflict.id(), conflict);
        stats.detected(conflict);
        Counter.builder("flowsync.sync.conflicts")
                .tag("type", conflict.type().name())
                .register(meterRegistry)
                .increment();
        log.info("Session {}: {} between visual {} and chat {}", sessionId, conflict.type(),
                conflict.visualChange().id(), conflict.chatChange().id());

        ChangeEvent pending = conflict.visualChange().isApplied() ? conflict.chatChange() : conflict.visualChange();
        if (properties.autoMergeCompatible() && conflict.autoResolvable()) {
            log.debug("Session {}: auto-merging compatible conflict {}", sessionId, conflict.id());
            SyncSnapshot merged = resolveConflict(conflict.id(), Resolution.MERGE);
            return new ChangeOutcome(pending.applied(), conflict, merged);
        }

        refresh();
        return new ChangeOutcome(pending, conflict, snapshot());
    }

    private ChangeOutcome apply(ChangeEvent change) {
        ChangeEvent result;
        try {
            GraphMemento memento = graph.apply(change.payload());
            result = change.applied();
            mementos.put(result.id(), memento);
            remember(result);
            lastError = null;
            countChange(change.source(), "applied");
        } catch (GraphMutationException e) {
            result = change.rejected(e.getMessage());
            lastError = e.getMessage();
            countChange(change.source(), "rejected");
            log.warn("Session {}: {} change {} rejected: {}", sessionId, change.source(), change.id(), e.getMessage());
        }
        refresh();
        notifyApplied(change, result);
        return new ChangeOutcome(result, null, snapshot());
    }

    private void remember(ChangeEvent applied) {
        Deque<ChangeEvent> window = recent.get(applied.source());
        window.addLast(applied);
        while (window.size() > properties.recentChangeLimit()) {
            ChangeEvent evicted = window.removeFirst();
            if (!referencedByConflict(evicted.id())) mementos.remove(evicted.id());
        }
    }

    /** Keeps the detection window aligned with the final status of a resolved half. */
    private void settleWindow(ChangeEvent before, ChangeEvent after) {
        Deque<ChangeEvent> window = recent.get(before.source());
        if (before.isApplied() && !after.isApplied()) {
            window.removeIf(c -> c.id().equals(before.id()));
            mementos.remove(before.id());
        } else if (!before.isApplied() && after.isApplied()) {
            remember(after);
        }
    }

    /** An applied change can sit in several open conflicts; all of them track its latest status. */
    private void propagate(ChangeEvent resolved) {
        conflicts.replaceAll((id, open) -> open.withChange(resolved));
    }

    private boolean referencedByConflict(String changeId) {
        return conflicts.values().stream().anyMatch(c ->
                c.visualChange().id().equals(changeId) || c.chatChange().id().equals(changeId));
    }

    private void notifyApplied(ChangeEvent before, ChangeEvent after) {
        if (before.isApplied() || !after.isApplied()) return;
        for (ChangeApplicationListener listener : applicationListeners) {
            try {
                listener.onApplied(after);
            } catch (RuntimeException e) {
                log.warn("Session {}: change listener failed for {}: {}", sessionId, after.id(), e.getMessage(), e);
            }
        }
    }

    private void countChange(ChangeSource source, String outcome) {
        Counter.builder("flowsync.sync.changes")
                .tag("source", source.name())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    private void refresh() {
        representation = snapshotBuilder.build(graph);
        settle();
        publish();
    }

    private void settle() {
        if (!enabled) {
            status = SyncStatus.DISABLED;
        } else if (!conflicts.isEmpty()) {
            status = SyncStatus.CONFLICT;
        } else if (lastError != null) {
            status = SyncStatus.ERROR;
        } else {
            status = SyncStatus.IDLE;
        }
    }

    private void publish() {
        SyncSnapshot snapshot = snapshot();
        for (Consumer<SyncSnapshot> subscriber : subscribers) {
            try {
                subscriber.accept(snapshot);
            } catch (RuntimeException e) {
                log.warn("Session {}: sync subscriber failed: {}", sessionId, e.getMessage(), e);
            }
        }
    }

    private void requireEnabled() {
        if (!enabled) throw new SyncNotEnabledException(sessionId);
    }
}
