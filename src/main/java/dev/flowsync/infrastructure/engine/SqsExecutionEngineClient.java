package dev.flowsync.infrastructure.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowsync.config.EngineProperties;
import dev.flowsync.domain.execution.JourneyDefinition;
import dev.flowsync.exception.ExecutionEngineException;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Dispatches control requests to the engine's SQS queue.
 *
 * <p>Design decisions:
 * <ul>
 * <li><b>Fire and forget</b>: a successful send only means the engine will see the
 * request; its effect arrives later as execution events.</li>
 * <li><b>Failures surface as {@link ExecutionEngineException}</b>: the streamer turns
 * them into a failed execution with an explanatory message, so SQS errors never
 * reach the HTTP caller as 500s.</li>
 * </ul>
 */
@Component
@Profile("!local")
public class SqsExecutionEngineClient implements ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(SqsExecutionEngineClient.class);

    private final SqsTemplate sqsTemplate;
    private final ObjectMapper objectMapper;
    private final String queueName;

    public SqsExecutionEngineClient(SqsTemplate sqsTemplate, ObjectMapper objectMapper, EngineProperties properties) {
        this.sqsTemplate = sqsTemplate;
        this.objectMapper = objectMapper;
        this.queueName = properties.controlQueue();
    }

    @Override
    public void start(JourneyDefinition journey, String executionId) {
        send(new EngineControlRequest("start", executionId, null, journey));
    }

    @Override
    public void pause(String executionId) {
        send(EngineControlRequest.of("pause", executionId));
    }

    @Override
    public void resume(String executionId) {
        send(EngineControlRequest.of("resume", executionId));
    }

    @Override
    public void stop(String executionId) {
        send(EngineControlRequest.of("stop", executionId));
    }

    @Override
    public void retryStep(String executionId, String stepId) {
        send(new EngineControlRequest("retry_step", executionId, stepId, null));
    }

    @Override
    public void skipStep(String executionId, String stepId) {
        send(new EngineControlRequest("skip_step", executionId, stepId, null));
    }

    private void send(EngineControlRequest request) {
        String body;
        try {
            body = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new ExecutionEngineException("Could not encode " + request.action() + " request", e);
        }
        try {
            sqsTemplate.send(queueName, body);
            log.info("Engine {} dispatched for execution {}", request.action(), request.executionId());
        } catch (RuntimeException e) {
            log.error("Engine {} for execution {} could not be queued: {}",
                    request.action(), request.executionId(), e.getMessage());
            throw new ExecutionEngineException("Execution engine unavailable: " + e.getMessage(), e);
        }
    }
}
