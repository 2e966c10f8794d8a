package dev.flowsync.domain.enums;

/**
 * Coarse execution state as shown in the chat representation of a workflow.
 */
public enum ExecutionState {
    IDLE, RUNNING, PAUSED, ERROR;

    public static ExecutionState of(ExecutionStatus status) {
        if (status == null) return IDLE;
        return switch (status) {
            case STARTING, RUNNING -> RUNNING;
            case PAUSED -> PAUSED;
            case ERROR, FAILED -> ERROR;
            case IDLE, COMPLETED, STOPPED -> IDLE;
        };
    }
}
