package dev.flowsync.infrastructure.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowsync.dto.request.EngineEventRequest;
import dev.flowsync.service.WorkflowExecutionService;
import io.awspring.cloud.sqs.annotation.SqsListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * SQS consumer for engine step events.
 *
 * <p>Delivery is at-least-once; the streamer drops duplicates by event id, so a message
 * redelivered after a crash is harmless. Malformed messages are acknowledged and logged
 * because they will never succeed. The returned future ties acknowledgement to the
 * session lane having applied the event; a failure there leaves the message for
 * redelivery.
 */
@Component
@Profile("!local")
public class ExecutionEventListener {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEventListener.class);

    private final WorkflowExecutionService executionService;
    private final ObjectMapper objectMapper;

    public ExecutionEventListener(WorkflowExecutionService executionService, ObjectMapper objectMapper) {
        this.executionService = executionService;
        this.objectMapper = objectMapper;
    }

    @SqsListener(value = "${flowsync.engine.event-queue}", maxConcurrentMessages = "10", maxMessagesPerPoll = "10")
    public CompletableFuture<Void> onEngineEvent(String message) {
        EngineEventRequest request;
        try {
            request = objectMapper.readValue(message, EngineEventRequest.class);
        } catch (JsonProcessingException e) {
            log.error("Invalid engine event in SQS message: {}", e.getOriginalMessage());
            return CompletableFuture.completedFuture(null);
        }
        CompletableFuture<Boolean> handled;
        try {
            handled = executionService.handleEngineEvent(request);
        } catch (IllegalArgumentException e) {
            log.error("Rejected engine event {}: {}", request.eventId(), e.getMessage());
            return CompletableFuture.completedFuture(null);
        }
        return handled.thenAccept(applied ->
                log.debug("Engine event {} for {} {}", request.eventId(), request.executionId(),
                        applied ? "applied" : "dropped"));
    }
}
