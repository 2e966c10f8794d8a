package dev.flowsync.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowsync.dto.request.EngineEventRequest;
import dev.flowsync.infrastructure.engine.EngineSignatureVerifier;
import dev.flowsync.infrastructure.engine.EngineSignatureVerifier.Verdict;
import dev.flowsync.service.WorkflowExecutionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP alternative to the SQS event queue for engines that call back directly.
 * Validates the HMAC signature against the raw body before any deserialization.
 */
@RestController
@RequestMapping("/engine")
public class EngineCallbackController {
    private static final Logger log = LoggerFactory.getLogger(EngineCallbackController.class);
    private final EngineSignatureVerifier signatureVerifier;
    private final WorkflowExecutionService executionService;
    private final ObjectMapper objectMapper;

    public EngineCallbackController(EngineSignatureVerifier signatureVerifier,
                                    WorkflowExecutionService executionService,
                                    ObjectMapper objectMapper) {
        this.signatureVerifier = signatureVerifier;
        this.executionService = executionService;
        this.objectMapper = objectMapper;
    }

    @PostMapping("/events")
    public CompletableFuture<ResponseEntity<Map<String, Object>>> handleEvent(
            @RequestHeader(value = "X-Engine-Signature", required = false) String signature,
            @RequestBody String rawBody) {

        Verdict verdict = signatureVerifier.authenticate(rawBody.getBytes(StandardCharsets.UTF_8), signature);
        if (!verdict.accepted()) {
            log.warn("Engine callback refused: {}", verdict);
            return CompletableFuture.completedFuture(ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("status", "rejected", "reason", verdict.reason())));
        }

        EngineEventRequest event;
        try {
            event = objectMapper.readValue(rawBody, EngineEventRequest.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize engine event: {}", e.getOriginalMessage());
            return CompletableFuture.completedFuture(ResponseEntity.badRequest()
                    .body(Map.of("status", "error", "reason", "invalid payload")));
        }

        return executionService.handleEngineEvent(event)
                .thenApply(applied -> ResponseEntity.ok(Map.<String, Object>of(
                        "status", applied ? "applied" : "dropped", "eventId", String.valueOf(event.eventId()))));
    }
}
