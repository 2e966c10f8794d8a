package dev.flowsync.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import dev.flowsync.domain.execution.Progress;
import dev.flowsync.domain.execution.ResourceSample;

import java.time.Instant;

/**
 * Engine event as it arrives over SQS or the HTTP callback. {@code detail} is decoded
 * into the variant named by {@code type}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EngineEventRequest(
        String eventId,
        String executionId,
        String type,
        String stepId,
        Instant timestamp,
        Progress progress,
        Long estimatedTimeRemainingMs,
        JsonNode detail,
        ResourceSample resources
) {}
