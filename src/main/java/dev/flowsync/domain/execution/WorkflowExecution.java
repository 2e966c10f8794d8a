package dev.flowsync.domain.execution;

import dev.flowsync.domain.enums.ExecutionStatus;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One run of a journey, mutated only by its session's streamer.
 *
 * <p>Transitions are guarded: each mark method names the statuses it may leave from and
 * throws {@link IllegalStateException} otherwise. endTime is set once, on the first
 * terminal transition.
 */
public class WorkflowExecution {

    private final String id;
    private final JourneyDefinition journey;
    private final String workspaceId;
    private final String userId;
    private final Instant startTime;
    private Instant endTime;
    private int currentStep;
    private String currentStepId;
    private ExecutionStatus status = ExecutionStatus.IDLE;
    private final MessageBuffer messages;
    private PerformanceMetrics performanceMetrics;
    private Long estimatedTimeRemaining;
    private PendingFailure pendingFailure;
    private final Set<String> seenEventIds = new HashSet<>();
    private final Map<String, StepOutcome> stepOutcomes = new HashMap<>();
    private final Map<String, Instant> stepStarts = new HashMap<>();

    public WorkflowExecution(String id, JourneyDefinition journey, String workspaceId, String userId,
                             Instant startTime, int maxMessages) {
        this.id = id;
        this.journey = journey;
        this.workspaceId = workspaceId;
        this.userId = userId;
        this.startTime = startTime;
        this.messages = new MessageBuffer(maxMessages);
        this.performanceMetrics = PerformanceMetrics.initial(journey.steps().size());
    }

    public void markStarting() {
        transitionFrom(ExecutionStatus.IDLE);
        this.status = ExecutionStatus.STARTING;
    }

    public void markRunning() {
        transitionFrom(ExecutionStatus.STARTING, ExecutionStatus.RUNNING, ExecutionStatus.PAUSED, ExecutionStatus.ERROR);
        this.status = ExecutionStatus.RUNNING;
        this.pendingFailure = null;
    }

    public void markPaused() {
        transitionFrom(ExecutionStatus.STARTING, ExecutionStatus.RUNNING, ExecutionStatus.PAUSED);
        this.status = ExecutionStatus.PAUSED;
    }

    public void markError(PendingFailure failure) {
        transitionFrom(ExecutionStatus.STARTING, ExecutionStatus.RUNNING, ExecutionStatus.PAUSED, ExecutionStatus.ERROR);
        this.status = ExecutionStatus.ERROR;
        this.pendingFailure = failure;
    }

    public void markCompleted(Instant at) {
        finish(ExecutionStatus.COMPLETED, at);
    }

    public void markFailed(Instant at) {
        finish(ExecutionStatus.FAILED, at);
    }

    public void markStopped(Instant at) {
        finish(ExecutionStatus.STOPPED, at);
    }

    /** Returns false when the event id was already seen. */
    public boolean registerEvent(String eventId) {
        return seenEventIds.add(eventId);
    }

    public ConversationalMessage appendMessage(ConversationalMessage message) {
        return messages.append(message);
    }

    public void stepStarted(String stepId, int stepNumber, Instant at) {
        this.currentStepId = stepId;
        this.currentStep = Math.max(currentStep, stepNumber);
        if (stepId != null) stepStarts.put(stepId, at);
    }

    /** Records a step's outcome once; a retried step moves between outcomes instead of counting twice. */
    public void recordOutcome(String stepId, StepOutcome outcome) {
        if (stepId == null) return;
        StepOutcome previous = stepOutcomes.get(stepId);
        if (previous == outcome) return;
        PerformanceMetrics updated = performanceMetrics.withOutcome(previous, outcome);
        if (updated == performanceMetrics) return;
        stepOutcomes.put(stepId, outcome);
        performanceMetrics = updated;
    }

    public void recordStepTime(long durationMs) {
        performanceMetrics = performanceMetrics.withStepTime(durationMs);
    }

    public void recordResources(ResourceSample sample) {
        performanceMetrics = performanceMetrics.withResources(sample);
    }

    public void updateEstimate(Long estimatedTimeRemainingMs) {
        if (estimatedTimeRemainingMs != null) this.estimatedTimeRemaining = estimatedTimeRemainingMs;
    }

    public void updateCurrentStep(int stepNumber) {
        this.currentStep = Math.max(currentStep, stepNumber);
    }

    public Optional<Instant> stepStart(String stepId) {
        return Optional.ofNullable(stepId != null ? stepStarts.get(stepId) : null);
    }

    public boolean isActive() {
        return status.isActive();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public List<ConversationalMessage> getMessages() {
        return messages.snapshot();
    }

    public int messageCount() {
        return messages.size();
    }

    // ── Internal ───────────────────────────────────────────────────

    private void finish(ExecutionStatus terminal, Instant at) {
        if (status.isTerminal())
            throw new IllegalStateException("Execution %s already %s".formatted(id, status));
        this.status = terminal;
        this.pendingFailure = null;
        this.estimatedTimeRemaining = 0L;
        if (endTime == null) endTime = at;
    }

    private void transitionFrom(ExecutionStatus... allowedPredecessors) {
        for (ExecutionStatus allowed : allowedPredecessors) {
            if (this.status == allowed) return;
        }
        throw new IllegalStateException(
                "Expected one of %s but was %s".formatted(Arrays.toString(allowedPredecessors), status));
    }

    // Getters
    public String getId() { return id; }

    public JourneyDefinition getJourney() { return journey; }

    public String getWorkspaceId() { return workspaceId; }

    public String getUserId() { return userId; }

    public Instant getStartTime() { return startTime; }

    public Instant getEndTime() { return endTime; }

    public int getCurrentStep() { return currentStep; }

    public String getCurrentStepId() { return currentStepId; }

    public ExecutionStatus getStatus() { return status; }

    public PerformanceMetrics getPerformanceMetrics() { return performanceMetrics; }

    public Long getEstimatedTimeRemaining() { return estimatedTimeRemaining; }

    public PendingFailure getPendingFailure() { return pendingFailure; }

    public int getMaxMessages() { return messages.capacity(); }

    /**
     * The step failure the user still has to act on while the execution is in ERROR.
     */
    public record PendingFailure(String stepId, String error, boolean canRetry, boolean canSkip, boolean canDebug) {}
}
