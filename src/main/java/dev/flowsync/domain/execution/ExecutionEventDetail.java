package dev.flowsync.domain.execution;

import dev.flowsync.domain.enums.ExecutionEventType;

/**
 * Type-specific data carried by an {@link ExecutionEvent}. One variant per event type.
 */
public interface ExecutionEventDetail {

    ExecutionEventType type();

    static Class<? extends ExecutionEventDetail> variantOf(ExecutionEventType type) {
        return switch (type) {
            case STEP_STARTED -> StepStarted.class;
            case STEP_COMPLETED -> StepCompleted.class;
            case STEP_FAILED -> StepFailed.class;
            case STEP_SKIPPED -> StepSkipped.class;
            case WORKFLOW_COMPLETED -> WorkflowCompleted.class;
            case WORKFLOW_FAILED -> WorkflowFailed.class;
            case WORKFLOW_PAUSED -> WorkflowPaused.class;
            case WORKFLOW_RESUMED -> WorkflowResumed.class;
            case WORKFLOW_STOPPED -> WorkflowStopped.class;
        };
    }

    record StepStarted(String stepName) implements ExecutionEventDetail {
        @Override public ExecutionEventType type() { return ExecutionEventType.STEP_STARTED; }
    }

    /** result is whatever the step produced; only its shape is used for the summary line. */
    record StepCompleted(Long durationMs, Object result) implements ExecutionEventDetail {
        @Override public ExecutionEventType type() { return ExecutionEventType.STEP_COMPLETED; }
    }

    record StepFailed(String error, boolean canRetry, boolean canSkip, boolean canDebug) implements ExecutionEventDetail {
        @Override public ExecutionEventType type() { return ExecutionEventType.STEP_FAILED; }
    }

    record StepSkipped(String reason) implements ExecutionEventDetail {
        @Override public ExecutionEventType type() { return ExecutionEventType.STEP_SKIPPED; }
    }

    record WorkflowCompleted(Long totalDurationMs) implements ExecutionEventDetail {
        @Override public ExecutionEventType type() { return ExecutionEventType.WORKFLOW_COMPLETED; }
    }

    record WorkflowFailed(String error) implements ExecutionEventDetail {
        @Override public ExecutionEventType type() { return ExecutionEventType.WORKFLOW_FAILED; }
    }

    record WorkflowPaused() implements ExecutionEventDetail {
        @Override public ExecutionEventType type() { return ExecutionEventType.WORKFLOW_PAUSED; }
    }

    record WorkflowResumed() implements ExecutionEventDetail {
        @Override public ExecutionEventType type() { return ExecutionEventType.WORKFLOW_RESUMED; }
    }

    record WorkflowStopped(String reason) implements ExecutionEventDetail {
        @Override public ExecutionEventType type() { return ExecutionEventType.WORKFLOW_STOPPED; }
    }
}
