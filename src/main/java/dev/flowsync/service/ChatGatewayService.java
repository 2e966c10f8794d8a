package dev.flowsync.service;

import dev.flowsync.domain.change.ChangeEvent;
import dev.flowsync.domain.change.ChangePayload;
import dev.flowsync.domain.enums.CommandType;
import dev.flowsync.domain.enums.ExecutionCommand;
import dev.flowsync.domain.enums.ExecutionState;
import dev.flowsync.domain.execution.ConversationalMessage;
import dev.flowsync.domain.execution.JourneyDefinition;
import dev.flowsync.dto.response.ChatResponse;
import dev.flowsync.exception.ExecutionNotActiveException;
import dev.flowsync.interpreter.ChatCommandTranslator;
import dev.flowsync.interpreter.CommandInterpreterAdapter;
import dev.flowsync.interpreter.ParsedCommand;
import dev.flowsync.session.WorkflowSession;
import dev.flowsync.session.WorkflowSessionRegistry;
import dev.flowsync.streaming.ExecutionSnapshot;
import dev.flowsync.sync.ChangeOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Entry point for free-text chat. The text is interpreted off the session lane (the
 * interpreter may call out over the network); the resulting command then runs on the lane.
 *
 * <p>Edits become chat-sourced change events, execution controls go to the session's
 * current run (pause, resume and stop by way of the synchronizer while sync is on), and anything the interpreter does not recognize is returned as
 * "not a command" for the caller to treat as conversation.
 */
@Service
public class ChatGatewayService {

    private static final Logger log = LoggerFactory.getLogger(ChatGatewayService.class);
    private static final String CHAT_ACTOR = "chat";
    private static final String NO_ACTIVE_WORKFLOW = "No active workflow found. Please start a workflow first.";

    private final CommandInterpreterAdapter interpreter;
    private final ChatCommandTranslator translator;
    private final WorkflowSessionRegistry registry;
    private final WorkflowExecutionService executions;
    private final Executor executor;
    private final Clock clock;

    public ChatGatewayService(CommandInterpreterAdapter interpreter,
                              ChatCommandTranslator translator,
                              WorkflowSessionRegistry registry,
                              WorkflowExecutionService executions,
                              @Qualifier("sessionExecutor") Executor executor,
                              Clock clock) {
        this.interpreter = interpreter;
        this.translator = translator;
        this.registry = registry;
        this.executions = executions;
        this.executor = executor;
        this.clock = clock;
    }

    public CompletableFuture<ChatResponse> handleMessage(String sessionId, String text, String userId) {
        return CompletableFuture.supplyAsync(() -> interpreter.interpret(text), executor)
                .thenCompose(parsed -> {
                    if (parsed.isEmpty()) return CompletableFuture.completedFuture(ChatResponse.notACommand());
                    ParsedCommand command = parsed.get();
                    log.info("Session {}: chat command {} from {}", sessionId, command.type(), userId);
                    return registry.withSession(sessionId, session -> dispatch(session, command, userId));
                });
    }

    /** An explicit control such as "pause" or "retry", applied to the session's current run. */
    public CompletableFuture<ChatResponse> handleCommand(String sessionId, String commandName,
                                                         Map<String, Object> parameters) {
        ExecutionCommand command = ExecutionCommand.fromWire(commandName);
        return registry.withSession(sessionId,
                session -> control(session, typeOf(command), command, parameters, CHAT_ACTOR));
    }

    // ── Internal ───────────────────────────────────────────────────

    private ChatResponse dispatch(WorkflowSession session, ParsedCommand command, String userId) {
        return switch (command.type().category()) {
            case EDIT -> {
                ChangePayload payload = translator.toChange(command, session.getGraph());
                ChangeEvent change = ChangeEvent.chat("chat_" + UUID.randomUUID(), clock.millis(), payload, userId);
                ChangeOutcome outcome = session.recordChatChange(change);
                yield new ChatResponse(command.type(), outcome, null, null);
            }
            case EXECUTION -> command.type() == CommandType.EXECUTE_WORKFLOW
                    ? execute(session, command, userId)
                    : control(session, command.type(), translator.toExecutionCommand(command.type()),
                            command.parameters(), userId);
            case QUERY -> status(session);
        };
    }

    private ChatResponse execute(WorkflowSession session, ParsedCommand command, String userId) {
        JourneyDefinition journey = JourneyDefinition.fromGraph(session.getGraph(), session.getGraph().getWorkflowId());
        String workspaceId = command.parameter("workspaceId") != null ? command.parameter("workspaceId") : session.getId();
        ExecutionSnapshot started = executions.start(session, WorkflowExecutionService.newExecutionId(),
                workspaceId, userId, journey);
        return new ChatResponse(command.type(), null, started, null);
    }

    private ChatResponse status(WorkflowSession session) {
        Optional<ExecutionSnapshot> current = session.currentExecution();
        if (current.isEmpty() || current.get().status().isTerminal())
            return new ChatResponse(CommandType.GET_STATUS, null, current.orElse(null), null);
        ConversationalMessage message = session.handleCommand(current.get().id(), ExecutionCommand.STATUS, Map.of());
        return new ChatResponse(CommandType.GET_STATUS, null, session.currentExecution().orElse(null), message);
    }

    /**
     * Pause, resume and stop are execution-state edits: while sync is enabled they are
     * recorded as chat changes and can conflict with the visual editor. Other controls,
     * and every control while sync is off, go straight to the current run.
     */
    private ChatResponse control(WorkflowSession session, CommandType type, ExecutionCommand command,
                                 Map<String, Object> parameters, String actorId) {
        ExecutionSnapshot current = session.currentExecution()
                .filter(e -> e.status().isActive())
                .orElseThrow(() -> new ExecutionNotActiveException(NO_ACTIVE_WORKFLOW));
        Optional<ExecutionState> target = targetState(command);
        if (target.isPresent() && session.getSynchronizer().isEnabled()) {
            ChangeEvent change = ChangeEvent.chat("chat_" + UUID.randomUUID(), clock.millis(),
                    new ChangePayload.ExecutionStateChanged(target.get()), actorId);
            WorkflowSession.ControlOutcome outcome = session.recordChatControl(change);
            return new ChatResponse(type, outcome.change(), session.currentExecution().orElse(null), outcome.reply());
        }
        ConversationalMessage message = session.handleCommand(current.id(), command, parameters);
        return new ChatResponse(type, null, session.currentExecution().orElse(null), message);
    }

    private static Optional<ExecutionState> targetState(ExecutionCommand command) {
        return switch (command) {
            case PAUSE -> Optional.of(ExecutionState.PAUSED);
            case RESUME -> Optional.of(ExecutionState.RUNNING);
            case STOP -> Optional.of(ExecutionState.IDLE);
            default -> Optional.empty();
        };
    }

    private static CommandType typeOf(ExecutionCommand command) {
        return command == ExecutionCommand.STATUS ? CommandType.GET_STATUS : CommandType.valueOf(command.name());
    }
}
