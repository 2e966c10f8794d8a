package dev.flowsync.infrastructure.engine;

import dev.flowsync.domain.execution.JourneyDefinition;

/**
 * Black-box workflow runner. Calls only dispatch requests; progress comes back
 * asynchronously as execution events.
 *
 * @throws dev.flowsync.exception.ExecutionEngineException from any method when the
 *         request cannot be handed to the engine
 */
public interface ExecutionEngine {

    void start(JourneyDefinition journey, String executionId);

    void pause(String executionId);

    void resume(String executionId);

    void stop(String executionId);

    void retryStep(String executionId, String stepId);

    void skipStep(String executionId, String stepId);
}
