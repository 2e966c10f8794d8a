package dev.flowsync.infrastructure.broadcast;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;

/**
 * Topic fan-out over WebSocket connections.
 *
 * <p>Each connection is wrapped in a {@link ConcurrentWebSocketSessionDecorator} because
 * different session lanes may publish to the same client at the same time. A slow client
 * that overruns the send buffer is dropped by the decorator rather than stalling a lane.
 */
@Component
public class WebSocketSessionBroadcaster implements SessionBroadcaster {

    private static final Logger log = LoggerFactory.getLogger(WebSocketSessionBroadcaster.class);
    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_SIZE_LIMIT = 512 * 1024;

    private final ObjectMapper objectMapper;
    private final Map<String, Set<String>> topics = new ConcurrentHashMap<>();
    private final Map<String, WebSocketSession> connections = new ConcurrentHashMap<>();

    public WebSocketSessionBroadcaster(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void publish(String topic, String eventType, Object payload) {
        Set<String> subscribers = topics.get(topic);
        if (subscribers == null || subscribers.isEmpty()) return;
        String json;
        try {
            json = objectMapper.writeValueAsString(envelope(topic, eventType, payload));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize {} for topic {}: {}", eventType, topic, e.getMessage());
            return;
        }
        TextMessage message = new TextMessage(json);
        for (String connectionId : subscribers) {
            send(connectionId, message);
        }
    }

    public void register(WebSocketSession connection) {
        connections.put(connection.getId(),
                new ConcurrentWebSocketSessionDecorator(connection, SEND_TIME_LIMIT_MS, BUFFER_SIZE_LIMIT));
    }

    public void subscribe(String topic, WebSocketSession connection) {
        topics.computeIfAbsent(topic, t -> new CopyOnWriteArraySet<>()).add(connection.getId());
        log.debug("Connection {} subscribed to {}", connection.getId(), topic);
    }

    public void unsubscribe(String topic, WebSocketSession connection) {
        Set<String> subscribers = topics.get(topic);
        if (subscribers != null) subscribers.remove(connection.getId());
    }

    /** Drops the connection from every topic. */
    public void remove(WebSocketSession connection) {
        connections.remove(connection.getId());
        topics.values().forEach(subscribers -> subscribers.remove(connection.getId()));
        topics.values().removeIf(Set::isEmpty);
    }

    /** Sends directly to one connection, outside any topic. */
    public void reply(WebSocketSession connection, String eventType, Object payload) {
        try {
            send(connection.getId(), new TextMessage(objectMapper.writeValueAsString(envelope(null, eventType, payload))));
        } catch (JsonProcessingException e) {
            log.error("Could not serialize {} reply: {}", eventType, e.getMessage());
        }
    }

    int subscriberCount(String topic) {
        Set<String> subscribers = topics.get(topic);
        return subscribers != null ? subscribers.size() : 0;
    }

    // ── Internal ───────────────────────────────────────────────────

    private void send(String connectionId, TextMessage message) {
        WebSocketSession connection = connections.get(connectionId);
        if (connection == null || !connection.isOpen()) return;
        try {
            connection.sendMessage(message);
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping message to connection {}: {}", connectionId, e.getMessage());
        }
    }

    private static Map<String, Object> envelope(String topic, String eventType, Object payload) {
        Map<String, Object> envelope = new LinkedHashMap<>();
        if (topic != null) envelope.put("topic", topic);
        envelope.put("type", eventType);
        envelope.put("payload", payload);
        return envelope;
    }
}
