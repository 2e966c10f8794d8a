package dev.flowsync.config;

import dev.flowsync.infrastructure.broadcast.WorkflowRoomHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final WorkflowRoomHandler roomHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(WorkflowRoomHandler roomHandler,
                           @Value("${flowsync.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.roomHandler = roomHandler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(roomHandler, "/ws").setAllowedOriginPatterns(allowedOrigins);
    }
}
