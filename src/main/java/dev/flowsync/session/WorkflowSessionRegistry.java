package dev.flowsync.session;

import dev.flowsync.domain.graph.WorkflowGraph;
import dev.flowsync.exception.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Owns every live {@link WorkflowSession} and the lane each one runs on.
 *
 * <p>Design decisions:
 * <ul>
 *   <li><b>Lane-only access</b>: sessions are never handed out directly; callers pass a
 *       function that runs on the session's lane and get a future of its result.</li>
 *   <li><b>Execution index</b>: engine events carry only an execution id, so the
 *       registry remembers which session started each execution until it is evicted.</li>
 * </ul>
 */
@Component
public class WorkflowSessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(WorkflowSessionRegistry.class);

    private final WorkflowSessionFactory factory;
    private final SessionLanes lanes;
    private final Clock clock;
    private final ConcurrentMap<String, WorkflowSession> sessions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> executionIndex = new ConcurrentHashMap<>();

    public WorkflowSessionRegistry(WorkflowSessionFactory factory, SessionLanes lanes, Clock clock) {
        this.factory = factory;
        this.lanes = lanes;
        this.clock = clock;
    }

    /**
     * Creates the session, or replaces the graph of an existing one that is neither
     * syncing nor executing.
     */
    public CompletableFuture<WorkflowSession> open(String sessionId, WorkflowGraph graph) {
        return lanes.submit(sessionId, () -> {
            WorkflowSession existing = sessions.get(sessionId);
            if (existing != null) {
                existing.replaceGraph(graph);
                return existing;
            }
            WorkflowSession created = factory.create(sessionId, graph);
            sessions.put(sessionId, created);
            log.info("Session {} opened for workflow {} ({} blocks)", sessionId, graph.getWorkflowId(), graph.nodeCount());
            return created;
        });
    }

    /** Runs the function on the session's lane. Fails with {@link SessionNotFoundException} for unknown ids. */
    public <T> CompletableFuture<T> withSession(String sessionId, Function<WorkflowSession, T> work) {
        return lanes.submit(sessionId, () -> work.apply(require(sessionId)));
    }

    public CompletableFuture<Void> close(String sessionId) {
        return lanes.submit(sessionId, () -> {
            WorkflowSession session = require(sessionId);
            session.close();
            sessions.remove(sessionId);
            executionIndex.values().removeIf(sessionId::equals);
            return (Void) null;
        }).whenComplete((ignored, error) -> {
            if (error == null) lanes.release(sessionId);
        });
    }

    public void indexExecution(String executionId, String sessionId) {
        executionIndex.put(executionId, sessionId);
    }

    public Optional<String> sessionForExecution(String executionId) {
        return Optional.ofNullable(executionIndex.get(executionId));
    }

    public boolean exists(String sessionId) {
        return sessions.containsKey(sessionId);
    }

    public int size() {
        return sessions.size();
    }

    /** Drops finished executions past their retention, one lane task per session. */
    @Scheduled(fixedDelayString = "${flowsync.streaming.eviction-interval:PT1M}")
    public void evictExpiredExecutions() {
        for (String sessionId : sessions.keySet()) {
            withSession(sessionId, session -> {
                int evicted = session.evictExpired(clock.instant());
                executionIndex.entrySet().removeIf(entry -> entry.getValue().equals(sessionId)
                        && session.execution(entry.getKey()).isEmpty());
                return evicted;
            }).whenComplete((evicted, error) -> {
                if (error != null) {
                    log.debug("Eviction skipped for session {}: {}", sessionId, error.getMessage());
                } else if (evicted > 0) {
                    log.debug("Session {}: {} finished executions evicted", sessionId, evicted);
                }
            });
        }
    }

    private WorkflowSession require(String sessionId) {
        WorkflowSession session = sessions.get(sessionId);
        if (session == null) throw new SessionNotFoundException(sessionId);
        return session;
    }
}
