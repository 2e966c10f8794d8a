package dev.flowsync.session;

import dev.flowsync.domain.change.ChangeEvent;
import dev.flowsync.domain.change.ChangePayload;
import dev.flowsync.domain.enums.ChangeSource;
import dev.flowsync.domain.enums.ExecutionCommand;
import dev.flowsync.domain.enums.ExecutionState;
import dev.flowsync.domain.enums.ExecutionStatus;
import dev.flowsync.domain.enums.ExportFormat;
import dev.flowsync.domain.enums.Resolution;
import dev.flowsync.domain.execution.ConversationalMessage;
import dev.flowsync.domain.execution.ExecutionEvent;
import dev.flowsync.domain.execution.JourneyDefinition;
import dev.flowsync.domain.graph.WorkflowGraph;
import dev.flowsync.exception.ExecutionAlreadyActiveException;
import dev.flowsync.exception.GraphMutationException;
import dev.flowsync.infrastructure.broadcast.SessionBroadcaster;
import dev.flowsync.streaming.ExecutionSnapshot;
import dev.flowsync.streaming.WorkflowExecutionStreamer;
import dev.flowsync.sync.ChangeOutcome;
import dev.flowsync.sync.Subscription;
import dev.flowsync.sync.SyncSnapshot;
import dev.flowsync.sync.WorkflowChatSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One editing session: the canonical graph, its synchronizer and its execution streamer.
 *
 * <p>Design decisions:
 * <ul>
 *   <li><b>Explicit wiring</b>: execution progress flows into the graph through the
 *       streamer's status observer, and applied {@code EXECUTION_STATE_CHANGED} changes
 *       flow back as engine commands through a change listener. Neither side knows
 *       about the other.</li>
 *   <li><b>Broadcast by subscription</b>: the session subscribes its broadcaster while
 *       sync is enabled and for the lifetime of each execution, so topic traffic stops
 *       as soon as either one ends.</li>
 * </ul>
 *
 * <p>Not thread-safe; the registry only calls it from the session's lane.
 */
public class WorkflowSession {

    private static final Logger log = LoggerFactory.getLogger(WorkflowSession.class);

    static final String SYNC_EVENT = "sync_state";
    static final String EXECUTION_EVENT = "execution_update";

    private final String id;
    private final WorkflowGraph graph;
    private final WorkflowChatSynchronizer synchronizer;
    private final WorkflowExecutionStreamer streamer;
    private final SessionBroadcaster broadcaster;
    private final Instant openedAt;

    private Subscription syncBroadcast;
    private ConversationalMessage forwardedReply;

    public WorkflowSession(String id,
                           WorkflowGraph graph,
                           WorkflowChatSynchronizer synchronizer,
                           WorkflowExecutionStreamer streamer,
                           SessionBroadcaster broadcaster,
                           Instant openedAt) {
        this.id = id;
        this.graph = graph;
        this.synchronizer = synchronizer;
        this.streamer = streamer;
        this.broadcaster = broadcaster;
        this.openedAt = openedAt;
        streamer.setStatusObserver(this::reflectExecution);
        synchronizer.onChangeApplied(this::forwardExecutionChange);
    }

    // ── Synchronization ────────────────────────────────────────────

    public SyncSnapshot enableSync() {
        if (syncBroadcast == null) {
            String topic = SessionBroadcaster.syncTopic(id);
            syncBroadcast = synchronizer.subscribe(snapshot -> broadcaster.publish(topic, SYNC_EVENT, snapshot));
        }
        return synchronizer.enableSync();
    }

    public SyncSnapshot disableSync() {
        SyncSnapshot snapshot = synchronizer.disableSync();
        syncBroadcast = null;
        return snapshot;
    }

    public ChangeOutcome recordVisualChange(ChangeEvent change) {
        return synchronizer.recordVisualChange(change);
    }

    public ChangeOutcome recordChatChange(ChangeEvent change) {
        return synchronizer.recordChatChange(change);
    }

    /**
     * Records a chat pause, resume or stop as an execution-state change so it goes through
     * conflict detection like any other chat edit. The engine command follows only if the
     * change is applied; a conflicted control waits for the conflict's resolution.
     */
    public ControlOutcome recordChatControl(ChangeEvent change) {
        if (!(change.payload() instanceof ChangePayload.ExecutionStateChanged))
            throw new IllegalArgumentException("Not an execution control: " + change.type());
        forwardedReply = null;
        try {
            ChangeOutcome outcome = synchronizer.recordChatChange(change);
            return new ControlOutcome(outcome, forwardedReply);
        } finally {
            forwardedReply = null;
        }
    }

    public SyncSnapshot resolveConflict(String conflictId, Resolution resolution) {
        return synchronizer.resolveConflict(conflictId, resolution);
    }

    /**
     * Swaps in a new graph for a session that is neither syncing nor executing.
     *
     * @throws GraphMutationException while sync is enabled or an execution is active
     */
    public void replaceGraph(WorkflowGraph replacement) {
        if (synchronizer.isEnabled() || streamer.hasActiveExecution())
            throw new GraphMutationException(
                    "Session %s is live; disable sync and stop the execution before replacing its graph".formatted(id));
        graph.replaceWith(replacement);
        log.info("Session {}: graph replaced ({} blocks, {} connections)", id, graph.nodeCount(), graph.edgeCount());
    }

    // ── Execution ──────────────────────────────────────────────────

    public ExecutionSnapshot startExecution(String executionId, String workspaceId, String userId,
                                            JourneyDefinition journey) {
        Optional<ExecutionSnapshot> current = streamer.currentExecution();
        if (current.isPresent() && current.get().status().isActive())
            throw new ExecutionAlreadyActiveException(current.get().id());

        String topic = SessionBroadcaster.executionTopic(id);
        Subscription subscription = streamer.subscribe(update -> broadcaster.publish(topic, EXECUTION_EVENT, update));
        try {
            return streamer.startWorkflowStreaming(executionId, workspaceId, userId, journey);
        } catch (RuntimeException e) {
            subscription.unsubscribe();
            throw e;
        }
    }

    public boolean handleExecutionEvent(ExecutionEvent event) {
        return streamer.handleExecutionEvent(event);
    }

    public ConversationalMessage handleCommand(String executionId, ExecutionCommand command,
                                               Map<String, Object> parameters) {
        return streamer.handleChatCommand(executionId, command, parameters);
    }

    public String exportLog(ExportFormat format) {
        return streamer.exportLog(format);
    }

    public Optional<ExecutionSnapshot> currentExecution() {
        return streamer.currentExecution();
    }

    public Optional<ExecutionSnapshot> execution(String executionId) {
        return streamer.execution(executionId);
    }

    public List<ConversationalMessage> messages() {
        return streamer.messages();
    }

    public int evictExpired(Instant now) {
        return streamer.evictExpired(now);
    }

    /** Stops an active execution and disables sync, releasing every listener. */
    public void close() {
        streamer.currentExecution()
                .filter(e -> e.status().isActive())
                .ifPresent(e -> streamer.handleChatCommand(e.id(), ExecutionCommand.STOP, Map.of("reason", "Session closed")));
        disableSync();
        log.info("Session {} closed", id);
    }

    // ── Internal ───────────────────────────────────────────────────

    private void reflectExecution(ExecutionSnapshot execution) {
        ExecutionStatus status = execution.status();
        boolean onStep = status == ExecutionStatus.RUNNING || status == ExecutionStatus.PAUSED
                || status == ExecutionStatus.ERROR;
        List<String> active = onStep && execution.currentStepId() != null
                ? List.of(execution.currentStepId())
                : List.of();
        synchronizer.reflectExecutionProgress(ExecutionState.of(status), active);
    }

    /**
     * An applied execution-state edit becomes an engine command for the active run. Visual
     * edits only move the run where it can go; chat controls are passed on as asked so the
     * user gets the streamer's answer either way.
     */
    private void forwardExecutionChange(ChangeEvent change) {
        if (!(change.payload() instanceof ChangePayload.ExecutionStateChanged changed)) return;
        Optional<ExecutionSnapshot> current = streamer.currentExecution().filter(e -> e.status().isActive());
        if (current.isEmpty()) return;

        ExecutionCommand command = change.source() == ChangeSource.CHAT
                ? controlFor(changed.state())
                : gatedControlFor(changed.state(), current.get().status());
        if (command == null) return;
        log.debug("Session {}: {} change {} forwarded as {}", id, change.source(), change.id(), command);
        forwardedReply = streamer.handleChatCommand(current.get().id(), command, Map.of());
        streamer.currentExecution().ifPresent(this::reflectExecution);
    }

    private static ExecutionCommand controlFor(ExecutionState state) {
        return switch (state) {
            case PAUSED -> ExecutionCommand.PAUSE;
            case RUNNING -> ExecutionCommand.RESUME;
            case IDLE -> ExecutionCommand.STOP;
            case ERROR -> null;
        };
    }

    private static ExecutionCommand gatedControlFor(ExecutionState state, ExecutionStatus status) {
        return switch (state) {
            case PAUSED -> status == ExecutionStatus.RUNNING || status == ExecutionStatus.STARTING
                    ? ExecutionCommand.PAUSE : null;
            case RUNNING -> status == ExecutionStatus.PAUSED ? ExecutionCommand.RESUME : null;
            case IDLE -> ExecutionCommand.STOP;
            case ERROR -> null;
        };
    }

    // Getters
    public String getId() { return id; }

    public WorkflowGraph getGraph() { return graph; }

    public SyncSnapshot getSyncState() { return synchronizer.snapshot(); }

    public WorkflowChatSynchronizer getSynchronizer() { return synchronizer; }

    public Instant getOpenedAt() { return openedAt; }

    /** A recorded chat control and the streamer's reply, null while the control is conflicted. */
    public record ControlOutcome(ChangeOutcome change, ConversationalMessage reply) {}
}
