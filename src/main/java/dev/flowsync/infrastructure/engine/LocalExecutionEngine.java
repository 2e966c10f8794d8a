package dev.flowsync.infrastructure.engine;

import dev.flowsync.domain.execution.JourneyDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Stand-in for local development: accepts every request and only logs it. Events are
 * posted by hand to {@code POST /engine/events}.
 */
@Component
@Profile("local")
public class LocalExecutionEngine implements ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(LocalExecutionEngine.class);

    @Override
    public void start(JourneyDefinition journey, String executionId) {
        log.info("[local engine] start {} with {} steps", executionId, journey.steps().size());
    }

    @Override
    public void pause(String executionId) {
        log.info("[local engine] pause {}", executionId);
    }

    @Override
    public void resume(String executionId) {
        log.info("[local engine] resume {}", executionId);
    }

    @Override
    public void stop(String executionId) {
        log.info("[local engine] stop {}", executionId);
    }

    @Override
    public void retryStep(String executionId, String stepId) {
        log.info("[local engine] retry {} step {}", executionId, stepId);
    }

    @Override
    public void skipStep(String executionId, String stepId) {
        log.info("[local engine] skip {} step {}", executionId, stepId);
    }
}
