package dev.flowsync.infrastructure.broadcast;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketSessionBroadcasterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private WebSocketSessionBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new WebSocketSessionBroadcaster(objectMapper);
    }

    @Test
    @DisplayName("publishes an envelope to each subscriber of the topic")
    void publish() throws Exception {
        WebSocketSession alice = connection("ws-1");
        WebSocketSession bob = connection("ws-2");
        broadcaster.register(alice);
        broadcaster.register(bob);
        broadcaster.subscribe("sessions/s1/sync", alice);

        broadcaster.publish("sessions/s1/sync", "sync_state", Map.of("enabled", true));

        JsonNode envelope = lastMessage(alice);
        assertThat(envelope.get("topic").asText()).isEqualTo("sessions/s1/sync");
        assertThat(envelope.get("type").asText()).isEqualTo("sync_state");
        assertThat(envelope.get("payload").get("enabled").asBoolean()).isTrue();
        verify(bob, never()).sendMessage(any());
    }

    @Test
    @DisplayName("removed connections leave every topic")
    void remove() throws Exception {
        WebSocketSession alice = connection("ws-1");
        broadcaster.register(alice);
        broadcaster.subscribe("sessions/s1/sync", alice);
        broadcaster.subscribe("sessions/s1/execution", alice);

        broadcaster.remove(alice);

        assertThat(broadcaster.subscriberCount("sessions/s1/sync")).isZero();
        assertThat(broadcaster.subscriberCount("sessions/s1/execution")).isZero();
    }

    @Test
    @DisplayName("a failing connection does not stop delivery to the others")
    void failingConnection() throws Exception {
        WebSocketSession broken = connection("ws-1");
        WebSocketSession healthy = connection("ws-2");
        doThrow(new IOException("reset")).when(broken).sendMessage(any());
        broadcaster.register(broken);
        broadcaster.register(healthy);
        broadcaster.subscribe("t", broken);
        broadcaster.subscribe("t", healthy);

        broadcaster.publish("t", "execution_update", Map.of("n", 1));

        verify(healthy).sendMessage(any());
    }

    @Test
    @DisplayName("replies go to one connection without a topic")
    void reply() throws Exception {
        WebSocketSession alice = connection("ws-1");
        broadcaster.register(alice);

        broadcaster.reply(alice, "subscribed", Map.of("topic", "t"));

        JsonNode envelope = lastMessage(alice);
        assertThat(envelope.has("topic")).isFalse();
        assertThat(envelope.get("type").asText()).isEqualTo("subscribed");
    }

    // ── Test Fixtures ──────────────────────────────────────────────

    private static WebSocketSession connection(String id) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        return session;
    }

    private JsonNode lastMessage(WebSocketSession connection) throws Exception {
        ArgumentCaptor<TextMessage> message = ArgumentCaptor.forClass(TextMessage.class);
        verify(connection).sendMessage(message.capture());
        return objectMapper.readTree(message.getValue().getPayload());
    }
}
