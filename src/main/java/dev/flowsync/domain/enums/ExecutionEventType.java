package dev.flowsync.domain.enums;

import java.util.Locale;

public enum ExecutionEventType {
    STEP_STARTED,
    STEP_COMPLETED,
    STEP_FAILED,
    STEP_SKIPPED,
    WORKFLOW_COMPLETED,
    WORKFLOW_FAILED,
    WORKFLOW_PAUSED,
    WORKFLOW_RESUMED,
    WORKFLOW_STOPPED;

    public boolean isStepEvent() {
        return name().startsWith("STEP_");
    }

    public static ExecutionEventType fromWire(String value) {
        if (value == null || value.isBlank()) throw new IllegalArgumentException("event type required");
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown execution event type: " + value);
        }
    }
}
