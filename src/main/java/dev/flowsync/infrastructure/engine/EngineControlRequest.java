package dev.flowsync.infrastructure.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.flowsync.domain.execution.JourneyDefinition;

/**
 * Control message sent to the engine. {@code journey} is only set for {@code start},
 * {@code stepId} only for step-level actions.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EngineControlRequest(String action, String executionId, String stepId, JourneyDefinition journey) {

    static EngineControlRequest of(String action, String executionId) {
        return new EngineControlRequest(action, executionId, null, null);
    }
}
