package dev.flowsync.service;

import dev.flowsync.domain.conflict.ConflictStats;
import dev.flowsync.domain.enums.ChangeSource;
import dev.flowsync.domain.enums.Resolution;
import dev.flowsync.domain.graph.WorkflowGraph;
import dev.flowsync.dto.request.ChangeRequest;
import dev.flowsync.dto.request.OpenSessionRequest;
import dev.flowsync.dto.response.SessionResponse;
import dev.flowsync.session.WorkflowSession;
import dev.flowsync.session.WorkflowSessionRegistry;
import dev.flowsync.sync.ChangeOutcome;
import dev.flowsync.sync.SyncSnapshot;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Session lifecycle and the synchronization side of a session. Every call is queued on
 * the session's lane and completes asynchronously.
 */
@Service
public class WorkflowSyncService {

    private final WorkflowSessionRegistry registry;
    private final WireMapper mapper;

    public WorkflowSyncService(WorkflowSessionRegistry registry, WireMapper mapper) {
        this.registry = registry;
        this.mapper = mapper;
    }

    public CompletableFuture<SessionResponse> open(String sessionId, OpenSessionRequest request) {
        WorkflowGraph graph = mapper.toGraph(sessionId, request);
        return registry.open(sessionId, graph).thenCompose(session -> describe(session.getId()));
    }

    public CompletableFuture<SessionResponse> describe(String sessionId) {
        return registry.withSession(sessionId, WorkflowSyncService::toResponse);
    }

    public CompletableFuture<Void> close(String sessionId) {
        return registry.close(sessionId);
    }

    public CompletableFuture<SyncSnapshot> enable(String sessionId) {
        return registry.withSession(sessionId, WorkflowSession::enableSync);
    }

    public CompletableFuture<SyncSnapshot> disable(String sessionId) {
        return registry.withSession(sessionId, WorkflowSession::disableSync);
    }

    public CompletableFuture<SyncSnapshot> state(String sessionId) {
        return registry.withSession(sessionId, WorkflowSession::getSyncState);
    }

    public CompletableFuture<ChangeOutcome> recordChange(String sessionId, ChangeSource source, ChangeRequest request) {
        return registry.withSession(sessionId, session -> source == ChangeSource.VISUAL
                ? session.recordVisualChange(mapper.toChange(request, source))
                : session.recordChatChange(mapper.toChange(request, source)));
    }

    public CompletableFuture<SyncSnapshot> resolve(String sessionId, String conflictId, String resolution) {
        Resolution strategy = Resolution.fromWire(resolution);
        return registry.withSession(sessionId, session -> session.resolveConflict(conflictId, strategy));
    }

    public CompletableFuture<ConflictStats> conflictStats(String sessionId) {
        return registry.withSession(sessionId, session -> session.getSynchronizer().conflictStats());
    }

    private static SessionResponse toResponse(WorkflowSession session) {
        WorkflowGraph graph = session.getGraph();
        return new SessionResponse(session.getId(), graph.getWorkflowId(), graph.nodeCount(), graph.edgeCount(),
                session.getOpenedAt(), session.getSyncState(), session.currentExecution().orElse(null));
    }
}
