package dev.flowsync.streaming;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowsync.config.StreamingProperties;
import dev.flowsync.domain.enums.ExecutionCommand;
import dev.flowsync.domain.enums.ExecutionStatus;
import dev.flowsync.domain.enums.ExportFormat;
import dev.flowsync.domain.execution.ConversationalMessage;
import dev.flowsync.domain.execution.ExecutionEvent;
import dev.flowsync.domain.execution.ExecutionEventDetail;
import dev.flowsync.domain.execution.JourneyDefinition;
import dev.flowsync.domain.execution.Progress;
import dev.flowsync.domain.execution.StepOutcome;
import dev.flowsync.domain.execution.WorkflowExecution;
import dev.flowsync.domain.execution.WorkflowExecution.PendingFailure;
import dev.flowsync.exception.ExecutionAlreadyActiveException;
import dev.flowsync.exception.ExecutionEngineException;
import dev.flowsync.exception.ExecutionNotActiveException;
import dev.flowsync.infrastructure.engine.ExecutionEngine;
import dev.flowsync.infrastructure.journal.ExecutionJournal;
import dev.flowsync.sync.Subscription;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Bridges one session's execution runs to conversational output.
 *
 * <p>Design decisions:
 * <ul>
 *   <li><b>One active execution</b>: starting while the current run is in any non-terminal
 *       status fails with {@link ExecutionAlreadyActiveException}.</li>
 *   <li><b>At-least-once safe</b>: event ids are remembered per execution; a duplicate
 *       changes nothing and appends nothing.</li>
 *   <li><b>Failures are data</b>: a failed step appends an ERROR message and parks the run
 *       in ERROR until the user retries, skips or stops it, or the engine ends it.
 *       Engine dispatch failures fail the run with a message instead of throwing.</li>
 *   <li><b>Retention</b>: a finished run stays queryable and exportable for the configured
 *       retention, then {@link #evictExpired(Instant)} drops it.</li>
 *   <li><b>Scoped subscriptions</b>: subscribers follow the current run and are dropped,
 *       synchronously, when it reaches a terminal status.</li>
 * </ul>
 *
 * <p>Not thread-safe; every call for a session runs on that session's lane.
 */
public class WorkflowExecutionStreamer {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecutionStreamer.class);

    private final String sessionId;
    private final ExecutionEngine engine;
    private final ConversationalMessageFactory messages;
    private final ExecutionLogExporter exporter;
    private final ExecutionJournal journal;
    private final ObjectMapper objectMapper;
    private final StreamingProperties properties;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final List<Consumer<ExecutionUpdate>> subscribers = new CopyOnWriteArrayList<>();
    private Consumer<ExecutionSnapshot> statusObserver = snapshot -> { };
    private WorkflowExecution current;
    private final Map<String, WorkflowExecution> finished = new LinkedHashMap<>();

    public WorkflowExecutionStreamer(String sessionId,
                                     ExecutionEngine engine,
                                     ConversationalMessageFactory messages,
                                     ExecutionLogExporter exporter,
                                     ExecutionJournal journal,
                                     ObjectMapper objectMapper,
                                     StreamingProperties properties,
                                     Clock clock,
                                     MeterRegistry meterRegistry) {
        this.sessionId = sessionId;
        this.engine = engine;
        this.messages = messages;
        this.exporter = exporter;
        this.journal = journal;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Creates the execution in STARTING, announces it and dispatches it to the engine.
     * Returns as soon as the run is wired; progress arrives through
     * {@link #handleExecutionEvent(ExecutionEvent)}.
     */
    public ExecutionSnapshot startWorkflowStreaming(String executionId, String workspaceId, String userId,
                                                    JourneyDefinition journey) {
        if (current != null && current.isActive()) throw new ExecutionAlreadyActiveException(current.getId());
        if (current != null) finished.put(current.getId(), current);

        WorkflowExecution execution = new WorkflowExecution(executionId, journey, workspaceId, userId,
                clock.instant(), properties.maxMessages());
        execution.markStarting();
        current = execution;
        count("flowsync.execution.started");
        log.info("Session {}: execution {} starting journey {} ({} steps)",
                sessionId, executionId, journey.id(), journey.steps().size());
        emit(execution, messages.started(journey));

        try {
            engine.start(journey, executionId);
        } catch (ExecutionEngineException e) {
            log.error("Session {}: engine rejected execution {}: {}", sessionId, executionId, e.getMessage());
            execution.markFailed(clock.instant());
            emit(execution, messages.engineFailure("start", e.getMessage()));
        }
        afterTransition(execution);
        return ExecutionSnapshot.of(execution);
    }

    /**
     * Applies one engine event. Returns false when it was dropped: duplicate id, unknown
     * execution, or an execution that already finished.
     */
    public boolean handleExecutionEvent(ExecutionEvent event) {
        WorkflowExecution execution = find(event.executionId()).orElse(null);
        if (execution == null) {
            log.warn("Session {}: event {} for unknown execution {} dropped",
                    sessionId, event.eventId(), event.executionId());
            return false;
        }
        if (execution.isTerminal()) {
            log.debug("Session {}: event {} for finished execution {} dropped",
                    sessionId, event.eventId(), execution.getId());
            return false;
        }
        if (!execution.registerEvent(event.eventId())) {
            count("flowsync.execution.duplicates");
            log.debug("Session {}: duplicate event {} dropped", sessionId, event.eventId());
            return false;
        }

        Counter.builder("flowsync.execution.events")
                .tag("type", event.type().name())
                .register(meterRegistry)
                .increment();
        execution.updateEstimate(event.estimatedTimeRemainingMs());
        execution.recordResources(event.resources());
        if (event.progress() != null) execution.updateCurrentStep(event.progress().currentStep());

        ExecutionStatus before = execution.getStatus();
        apply(execution, event);
        if (execution.getStatus() != before || event.type().isStepEvent()) afterTransition(execution);
        return true;
    }

    /**
     * Runs a user command against an execution and returns the one message describing the outcome.
     * Commands that do not fit the current status produce a WARNING rather than an exception.
     *
     * @throws ExecutionNotActiveException when the execution is unknown or already finished
     */
    public ConversationalMessage handleChatCommand(String executionId, ExecutionCommand command,
                                                   Map<String, Object> parameters) {
        WorkflowExecution execution = find(executionId)
                .orElseThrow(() -> new ExecutionNotActiveException(
                        "No active workflow found. Please start a workflow first."));
        if (execution.isTerminal())
            throw new ExecutionNotActiveException(
                    "Execution %s is %s and no longer accepts commands".formatted(executionId, execution.getStatus()));

        log.info("Session {}: command {} on execution {} ({})", sessionId, command, executionId, execution.getStatus());
        Counter.builder("flowsync.execution.commands")
                .tag("command", command.name())
                .register(meterRegistry)
                .increment();

        ConversationalMessage result;
        try {
            result = dispatch(execution, command, parameters != null ? parameters : Map.of());
        } catch (ExecutionEngineException e) {
            log.error("Session {}: engine rejected {} for {}: {}", sessionId, command, executionId, e.getMessage());
            execution.markFailed(clock.instant());
            result = messages.engineFailure(command.name().toLowerCase(Locale.ROOT), e.getMessage());
        }
        emit(execution, result);
        afterTransition(execution);
        return result;
    }

    /** Serializes the current (or most recently finished) execution's message log. */
    public String exportLog(ExportFormat format) {
        WorkflowExecution execution = current;
        if (execution == null) throw new ExecutionNotActiveException("No execution to export");
        return exporter.export(ExecutionSnapshot.of(execution), execution.getMessages(), format, clock.instant());
    }

    public Subscription subscribe(Consumer<ExecutionUpdate> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    /** Session wiring: called after every status change or step event of the current run. */
    public void setStatusObserver(Consumer<ExecutionSnapshot> observer) {
        this.statusObserver = observer != null ? observer : snapshot -> { };
    }

    /** Drops finished executions whose retention has elapsed. Returns how many were dropped. */
    public int evictExpired(Instant now) {
        Duration retention = properties.completedRetention();
        int before = finished.size();
        finished.values().removeIf(e -> expired(e, now, retention));
        int evicted = before - finished.size();
        if (current != null && expired(current, now, retention)) {
            log.debug("Session {}: evicting finished execution {}", sessionId, current.getId());
            current = null;
            evicted++;
        }
        return evicted;
    }

    public Optional<ExecutionSnapshot> currentExecution() {
        return Optional.ofNullable(current).map(ExecutionSnapshot::of);
    }

    public Optional<ExecutionSnapshot> execution(String executionId) {
        return find(executionId).map(ExecutionSnapshot::of);
    }

    public List<ConversationalMessage> messages() {
        return current != null ? current.getMessages() : List.of();
    }

    public boolean hasActiveExecution() {
        return current != null && current.isActive();
    }

    /** True when nothing is running and nothing is retained. */
    public boolean isIdle() {
        return current == null && finished.isEmpty();
    }

    // ── Event handling ─────────────────────────────────────────────

    private void apply(WorkflowExecution execution, ExecutionEvent event) {
        Progress progress = progressOf(execution, event);
        String stepName = stepName(execution, event.stepId());
        ExecutionEventDetail detail = event.detail();

        if (detail instanceof ExecutionEventDetail.StepStarted started) {
            resumeIfParked(execution);
            execution.stepStarted(event.stepId(), progress.currentStep(), timestampOf(event));
            String name = started.stepName() != null ? started.stepName() : stepName;
            emit(execution, messages.stepStarted(event.stepId(), name, progress));
        } else if (detail instanceof ExecutionEventDetail.StepCompleted completed) {
            resumeIfParked(execution);
            Long duration = completed.durationMs() != null
                    ? completed.durationMs()
                    : execution.stepStart(event.stepId())
                            .map(start -> Duration.between(start, timestampOf(event)).toMillis())
                            .orElse(null);
            if (duration != null) execution.recordStepTime(duration);
            execution.recordOutcome(event.stepId(), StepOutcome.COMPLETED);
            emit(execution, messages.stepCompleted(event.stepId(), stepName, completed.result(), duration, progress));
        } else if (detail instanceof ExecutionEventDetail.StepFailed failed) {
            execution.recordOutcome(event.stepId(), StepOutcome.FAILED);
            execution.markError(new PendingFailure(event.stepId(), failed.error(),
                    failed.canRetry(), failed.canSkip(), failed.canDebug()));
            count("flowsync.execution.step.failures");
            emit(execution, messages.stepFailed(event.stepId(), stepName, progress.currentStep(), failed));
        } else if (detail instanceof ExecutionEventDetail.StepSkipped skipped) {
            resumeIfParked(execution);
            execution.recordOutcome(event.stepId(), StepOutcome.SKIPPED);
            emit(execution, messages.stepSkipped(event.stepId(), stepName, skipped.reason(), progress));
        } else if (detail instanceof ExecutionEventDetail.WorkflowCompleted) {
            if (execution.getStatus() == ExecutionStatus.ERROR) {
                failFromError(execution, "The engine finished while a failed step was unresolved.");
            } else {
                execution.markCompleted(timestampOf(event));
                emit(execution, messages.workflowCompleted(execution,
                        Duration.between(execution.getStartTime(), execution.getEndTime())));
            }
        } else if (detail instanceof ExecutionEventDetail.WorkflowFailed workflowFailed) {
            execution.markFailed(timestampOf(event));
            emit(execution, messages.workflowFailed(workflowFailed.error()));
        } else if (detail instanceof ExecutionEventDetail.WorkflowPaused) {
            if (execution.getStatus() == ExecutionStatus.RUNNING || execution.getStatus() == ExecutionStatus.STARTING) {
                execution.markPaused();
                emit(execution, messages.paused());
            }
        } else if (detail instanceof ExecutionEventDetail.WorkflowResumed) {
            if (execution.getStatus() == ExecutionStatus.PAUSED) {
                execution.markRunning();
                emit(execution, messages.resumed());
            }
        } else if (detail instanceof ExecutionEventDetail.WorkflowStopped stopped) {
            if (execution.getStatus() == ExecutionStatus.ERROR) {
                failFromError(execution, stopped.reason());
            } else {
                execution.markStopped(timestampOf(event));
                emit(execution, messages.stopped(stopped.reason()));
            }
        }
    }

    private ConversationalMessage dispatch(WorkflowExecution execution, ExecutionCommand command,
                                           Map<String, Object> parameters) {
        ExecutionStatus status = execution.getStatus();
        PendingFailure failure = execution.getPendingFailure();
        switch (command) {
            case PAUSE -> {
                if (status != ExecutionStatus.RUNNING && status != ExecutionStatus.STARTING)
                    return messages.warning("Cannot pause: the workflow is %s.".formatted(status), execution.getCurrentStepId());
                engine.pause(execution.getId());
                execution.markPaused();
                return messages.paused();
            }
            case RESUME -> {
                if (status != ExecutionStatus.PAUSED)
                    return messages.warning("Cannot resume: the workflow is %s.".formatted(status), execution.getCurrentStepId());
                engine.resume(execution.getId());
                execution.markRunning();
                return messages.resumed();
            }
            case STOP -> {
                engine.stop(execution.getId());
                Object reason = parameters.get("reason");
                if (status == ExecutionStatus.ERROR) {
                    execution.markFailed(clock.instant());
                } else {
                    execution.markStopped(clock.instant());
                }
                return messages.stopped(reason != null ? reason.toString() : null);
            }
            case RETRY -> {
                if (status != ExecutionStatus.ERROR || failure == null || !failure.canRetry())
                    return messages.warning("Nothing to retry: no failed step allows a retry.", execution.getCurrentStepId());
                engine.retryStep(execution.getId(), failure.stepId());
                execution.markRunning();
                return messages.retrying(failure.stepId());
            }
            case SKIP -> {
                if (status != ExecutionStatus.ERROR || failure == null || !failure.canSkip())
                    return messages.warning("Nothing to skip: no failed step allows skipping.", execution.getCurrentStepId());
                engine.skipStep(execution.getId(), failure.stepId());
                execution.recordOutcome(failure.stepId(), StepOutcome.SKIPPED);
                execution.markRunning();
                return messages.skipping(failure.stepId());
            }
            case DEBUG -> {
                if (failure != null && !failure.canDebug())
                    return messages.warning("Debug information is not available for this failure.", failure.stepId());
                return messages.debug(execution.getCurrentStepId(), debugJson(execution));
            }
            case STATUS -> {
                return messages.status(execution);
            }
        }
        throw new IllegalArgumentException("Unsupported command: " + command);
    }

    // ── Internal ───────────────────────────────────────────────────

    /** A new step event after a failure means the engine moved on. */
    private static void resumeIfParked(WorkflowExecution execution) {
        ExecutionStatus status = execution.getStatus();
        if (status == ExecutionStatus.STARTING || status == ExecutionStatus.ERROR) execution.markRunning();
    }

    private void failFromError(WorkflowExecution execution, String reason) {
        PendingFailure failure = execution.getPendingFailure();
        execution.markFailed(clock.instant());
        String error = failure != null && failure.error() != null ? failure.error() : reason;
        emit(execution, messages.workflowFailed(error));
    }

    private Progress progressOf(WorkflowExecution execution, ExecutionEvent event) {
        if (event.progress() != null) return event.progress();
        int total = execution.getJourney().steps().size();
        int index = execution.getJourney().indexOf(event.stepId());
        int stepNumber = index >= 0 ? index + 1 : execution.getCurrentStep();
        return Progress.of(stepNumber, total);
    }

    private static String stepName(WorkflowExecution execution, String stepId) {
        if (stepId == null) return "Unknown step";
        return execution.getJourney().step(stepId).map(JourneyDefinition.Step::displayName).orElse(stepId);
    }

    private Instant timestampOf(ExecutionEvent event) {
        return event.timestamp() != null ? event.timestamp() : clock.instant();
    }

    private String debugJson(WorkflowExecution execution) {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("executionId", execution.getId());
        info.put("status", execution.getStatus());
        info.put("currentStep", execution.getCurrentStep());
        info.put("currentStepId", execution.getCurrentStepId());
        execution.getJourney().step(execution.getCurrentStepId()).ifPresent(step -> info.put("step", step));
        if (execution.getPendingFailure() != null) info.put("failure", execution.getPendingFailure());
        info.put("performanceMetrics", execution.getPerformanceMetrics());
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(info);
        } catch (JsonProcessingException e) {
            log.warn("Session {}: could not render debug info: {}", sessionId, e.getMessage());
            return info.toString();
        }
    }

    private Optional<WorkflowExecution> find(String executionId) {
        if (current != null && current.getId().equals(executionId)) return Optional.of(current);
        return Optional.ofNullable(finished.get(executionId));
    }

    private void emit(WorkflowExecution execution, ConversationalMessage message) {
        execution.appendMessage(message);
        journal.append(sessionId, execution.getId(), message);
        ExecutionUpdate update = new ExecutionUpdate(ExecutionSnapshot.of(execution), message);
        for (Consumer<ExecutionUpdate> subscriber : subscribers) {
            try {
                subscriber.accept(update);
            } catch (RuntimeException e) {
                log.warn("Session {}: execution subscriber failed: {}", sessionId, e.getMessage(), e);
            }
        }
    }

    private void afterTransition(WorkflowExecution execution) {
        ExecutionSnapshot snapshot = ExecutionSnapshot.of(execution);
        try {
            statusObserver.accept(snapshot);
        } catch (RuntimeException e) {
            log.warn("Session {}: status observer failed: {}", sessionId, e.getMessage(), e);
        }
        if (execution.isTerminal()) {
            count("flowsync.execution." + execution.getStatus().name().toLowerCase(Locale.ROOT));
            log.info("Session {}: execution {} finished {} ({} completed, {} failed, {} skipped of {})",
                    sessionId, execution.getId(), execution.getStatus(),
                    execution.getPerformanceMetrics().completedSteps(),
                    execution.getPerformanceMetrics().failedSteps(),
                    execution.getPerformanceMetrics().skippedSteps(),
                    execution.getPerformanceMetrics().totalSteps());
            subscribers.clear();
        }
    }

    private static boolean expired(WorkflowExecution execution, Instant now, Duration retention) {
        return execution.isTerminal() && execution.getEndTime() != null
                && !execution.getEndTime().plus(retention).isAfter(now);
    }

    private void count(String name) {
        meterRegistry.counter(name).increment();
    }
}
