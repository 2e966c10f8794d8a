package dev.flowsync.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A change as posted by the visual editor or a chat client. {@code data} is decoded
 * into the payload variant named by {@code type}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChangeRequest(String id, String type, Long timestamp, String actorId, JsonNode data) {}
