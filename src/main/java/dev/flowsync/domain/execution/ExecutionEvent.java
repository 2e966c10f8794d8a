package dev.flowsync.domain.execution;

import com.fasterxml.jackson.annotation.JsonIgnore;
import dev.flowsync.domain.enums.ExecutionEventType;

import java.time.Instant;

/**
 * One step-level event reported by the execution engine. Delivery is at-least-once;
 * eventId identifies duplicates.
 */
public record ExecutionEvent(
        String eventId,
        String executionId,
        String stepId,
        Instant timestamp,
        Progress progress,
        Long estimatedTimeRemainingMs,
        ExecutionEventDetail detail,
        ResourceSample resources
) {
    public ExecutionEvent {
        if (eventId == null || eventId.isBlank()) throw new IllegalArgumentException("eventId required");
        if (executionId == null || executionId.isBlank()) throw new IllegalArgumentException("executionId required");
        if (detail == null) throw new IllegalArgumentException("event detail required");
    }

    @JsonIgnore
    public ExecutionEventType type() {
        return detail.type();
    }
}
