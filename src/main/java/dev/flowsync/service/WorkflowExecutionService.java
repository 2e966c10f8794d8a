package dev.flowsync.service;

import dev.flowsync.domain.enums.ExecutionCommand;
import dev.flowsync.domain.enums.ExportFormat;
import dev.flowsync.domain.execution.ConversationalMessage;
import dev.flowsync.domain.execution.ExecutionEvent;
import dev.flowsync.domain.execution.JourneyDefinition;
import dev.flowsync.dto.request.CommandRequest;
import dev.flowsync.dto.request.EngineEventRequest;
import dev.flowsync.dto.request.StartExecutionRequest;
import dev.flowsync.dto.response.CommandResponse;
import dev.flowsync.session.WorkflowSession;
import dev.flowsync.session.WorkflowSessionRegistry;
import dev.flowsync.streaming.ExecutionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Execution side of a session: starting runs, routing engine events to the session
 * that owns the run, and user commands.
 */
@Service
public class WorkflowExecutionService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutionService.class);

    private final WorkflowSessionRegistry registry;
    private final WireMapper mapper;

    public WorkflowExecutionService(WorkflowSessionRegistry registry, WireMapper mapper) {
        this.registry = registry;
        this.mapper = mapper;
    }

    public CompletableFuture<ExecutionSnapshot> start(String sessionId, StartExecutionRequest request, String userId) {
        StartExecutionRequest body = request != null ? request : new StartExecutionRequest(null, null, null);
        String executionId = body.executionId() != null ? body.executionId() : newExecutionId();
        return registry.withSession(sessionId, session -> {
            JourneyDefinition journey = mapper.toJourney(body.journey(), session.getGraph());
            String workspaceId = body.workspaceId() != null ? body.workspaceId() : sessionId;
            return start(session, executionId, workspaceId, userId, journey);
        });
    }

    /** Lane-side start shared with the chat gateway. */
    ExecutionSnapshot start(WorkflowSession session, String executionId, String workspaceId, String userId,
                            JourneyDefinition journey) {
        ExecutionSnapshot started = session.startExecution(executionId, workspaceId, userId, journey);
        registry.indexExecution(executionId, session.getId());
        return started;
    }

    /**
     * Routes one engine event to the owning session. Completes with false when the event
     * was dropped (unknown execution, duplicate, already finished).
     */
    public CompletableFuture<Boolean> handleEngineEvent(EngineEventRequest request) {
        ExecutionEvent event = mapper.toExecutionEvent(request);
        Optional<String> sessionId = registry.sessionForExecution(event.executionId());
        if (sessionId.isEmpty()) {
            log.warn("Engine event {} for unknown execution {} dropped", event.eventId(), event.executionId());
            return CompletableFuture.completedFuture(false);
        }
        return registry.withSession(sessionId.get(), session -> session.handleExecutionEvent(event));
    }

    public CompletableFuture<CommandResponse> command(String sessionId, String executionId, CommandRequest request) {
        ExecutionCommand command = ExecutionCommand.fromWire(request != null ? request.command() : null);
        return registry.withSession(sessionId, session -> {
            ConversationalMessage message = session.handleCommand(executionId, command,
                    request.parameters());
            return new CommandResponse(message, session.execution(executionId).orElse(null));
        });
    }

    public CompletableFuture<Optional<ExecutionSnapshot>> current(String sessionId) {
        return registry.withSession(sessionId, WorkflowSession::currentExecution);
    }

    public CompletableFuture<List<ConversationalMessage>> messages(String sessionId) {
        return registry.withSession(sessionId, WorkflowSession::messages);
    }

    public CompletableFuture<String> exportLog(String sessionId, ExportFormat format) {
        return registry.withSession(sessionId, session -> session.exportLog(format));
    }

    static String newExecutionId() {
        return "exec_" + UUID.randomUUID();
    }
}
