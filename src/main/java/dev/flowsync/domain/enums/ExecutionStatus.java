package dev.flowsync.domain.enums;

/**
 * Lifecycle: IDLE → STARTING → RUNNING ⇄ PAUSED → COMPLETED | FAILED | STOPPED.
 * RUNNING/PAUSED → ERROR on a step failure; ERROR → RUNNING on retry/skip, otherwise FAILED.
 */
public enum ExecutionStatus {
    IDLE, STARTING, RUNNING, PAUSED, ERROR, COMPLETED, FAILED, STOPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == STOPPED;
    }

    public boolean isActive() {
        return this == STARTING || this == RUNNING || this == PAUSED || this == ERROR;
    }
}
