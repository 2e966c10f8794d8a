package dev.flowsync.streaming;

import dev.flowsync.domain.enums.ExecutionStatus;
import dev.flowsync.domain.execution.PerformanceMetrics;
import dev.flowsync.domain.execution.WorkflowExecution;

import java.time.Instant;

/**
 * Read-only copy of a {@link WorkflowExecution}'s scalar state, safe to hand to other threads.
 */
public record ExecutionSnapshot(
        String id,
        String journeyId,
        String journeyTitle,
        String workspaceId,
        String userId,
        Instant startTime,
        Instant endTime,
        int currentStep,
        String currentStepId,
        int totalSteps,
        ExecutionStatus status,
        PerformanceMetrics performanceMetrics,
        Long estimatedTimeRemaining,
        int messageCount,
        int maxMessages
) {
    public static ExecutionSnapshot of(WorkflowExecution execution) {
        return new ExecutionSnapshot(
                execution.getId(),
                execution.getJourney().id(),
                execution.getJourney().title(),
                execution.getWorkspaceId(),
                execution.getUserId(),
                execution.getStartTime(),
                execution.getEndTime(),
                execution.getCurrentStep(),
                execution.getCurrentStepId(),
                execution.getJourney().steps().size(),
                execution.getStatus(),
                execution.getPerformanceMetrics(),
                execution.getEstimatedTimeRemaining(),
                execution.messageCount(),
                execution.getMaxMessages());
    }
}
