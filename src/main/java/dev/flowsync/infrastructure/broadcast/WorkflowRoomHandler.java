package dev.flowsync.infrastructure.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowsync.dto.response.ChatResponse;
import dev.flowsync.service.ChatGatewayService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.security.Principal;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Client side of the {@code /ws} endpoint.
 *
 * <p>Inbound frames are JSON objects with an {@code action}:
 * <ul>
 *   <li>{@code subscribe} / {@code unsubscribe} with a {@code topic}
 *       ({@code sessions/{id}/sync} or {@code sessions/{id}/execution})</li>
 *   <li>{@code chat_message} with {@code sessionId} and free {@code text}</li>
 *   <li>{@code chat_command} with {@code sessionId}, {@code command} and optional {@code parameters}</li>
 * </ul>
 * Results of chat actions come back to the sender only, as {@code chat_result} or {@code error}.
 */
@Component
public class WorkflowRoomHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowRoomHandler.class);
    private static final String TOPIC_PREFIX = "sessions/";

    private final WebSocketSessionBroadcaster broadcaster;
    private final ChatGatewayService chatGateway;
    private final ObjectMapper objectMapper;

    public WorkflowRoomHandler(WebSocketSessionBroadcaster broadcaster, ChatGatewayService chatGateway,
                               ObjectMapper objectMapper) {
        this.broadcaster = broadcaster;
        this.chatGateway = chatGateway;
        this.objectMapper = objectMapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession connection) {
        broadcaster.register(connection);
        log.debug("WebSocket connection {} opened", connection.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession connection, CloseStatus status) {
        broadcaster.remove(connection);
        log.debug("WebSocket connection {} closed: {}", connection.getId(), status);
    }

    @Override
    protected void handleTextMessage(WebSocketSession connection, TextMessage frame) {
        JsonNode node;
        try {
            node = objectMapper.readTree(frame.getPayload());
        } catch (JsonProcessingException e) {
            broadcaster.reply(connection, "error", Map.of("message", "Malformed frame"));
            return;
        }
        String action = node.path("action").asText("");
        switch (action) {
            case "subscribe" -> withTopic(connection, node, topic -> {
                broadcaster.subscribe(topic, connection);
                broadcaster.reply(connection, "subscribed", Map.of("topic", topic));
            });
            case "unsubscribe" -> withTopic(connection, node, topic -> {
                broadcaster.unsubscribe(topic, connection);
                broadcaster.reply(connection, "unsubscribed", Map.of("topic", topic));
            });
            case "chat_message" -> relay(connection, () -> chatGateway.handleMessage(
                    node.path("sessionId").asText(), node.path("text").asText(), userOf(connection)));
            case "chat_command" -> relay(connection, () -> chatGateway.handleCommand(
                    node.path("sessionId").asText(), node.path("command").asText(null), parametersOf(node)));
            default -> broadcaster.reply(connection, "error", Map.of("message", "Unknown action: " + action));
        }
    }

    // ── Internal ───────────────────────────────────────────────────

    private void withTopic(WebSocketSession connection, JsonNode node, Consumer<String> action) {
        String topic = node.path("topic").asText("");
        if (!topic.startsWith(TOPIC_PREFIX) || !(topic.endsWith("/sync") || topic.endsWith("/execution"))) {
            broadcaster.reply(connection, "error", Map.of("message", "Unknown topic: " + topic));
            return;
        }
        action.accept(topic);
    }

    private void relay(WebSocketSession connection, Supplier<CompletableFuture<ChatResponse>> action) {
        CompletableFuture<ChatResponse> result;
        try {
            result = action.get();
        } catch (RuntimeException e) {
            result = CompletableFuture.failedFuture(e);
        }
        result.whenComplete((response, error) -> {
            if (error == null) {
                broadcaster.reply(connection, "chat_result", response);
                return;
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            log.debug("Chat action on connection {} failed: {}", connection.getId(), cause.getMessage());
            broadcaster.reply(connection, "error", Map.of("message", String.valueOf(cause.getMessage())));
        });
    }

    private Map<String, Object> parametersOf(JsonNode node) {
        JsonNode parameters = node.get("parameters");
        if (parameters == null || !parameters.isObject()) return Map.of();
        return objectMapper.convertValue(parameters, new TypeReference<Map<String, Object>>() { });
    }

    private static String userOf(WebSocketSession connection) {
        Principal principal = connection.getPrincipal();
        return principal != null ? principal.getName() : "anonymous";
    }
}
