package dev.flowsync.domain.execution;

public enum StepOutcome {
    COMPLETED, FAILED, SKIPPED
}
