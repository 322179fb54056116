package com.chatflow.presence.config;

import com.chatflow.presence.handler.IdentityHandshakeInterceptor;
import com.chatflow.presence.handler.PresenceWebSocketHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@Slf4j
public class WebSocketConfig implements WebSocketConfigurer {

    private final PresenceWebSocketHandler presenceHandler;
    private final IdentityHandshakeInterceptor handshakeInterceptor;

    @Value("${presence.websocket.path:/ws}")
    private String path;

    @Value("${presence.websocket.allowed-origins:http://localhost:3000}")
    private String[] allowedOrigins;

    public WebSocketConfig(PresenceWebSocketHandler presenceHandler,
            IdentityHandshakeInterceptor handshakeInterceptor) {
        this.presenceHandler = presenceHandler;
        this.handshakeInterceptor = handshakeInterceptor;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        log.info("Registering presence WebSocket endpoint at {}", path);
        registry.addHandler(presenceHandler, path)
                .addInterceptors(handshakeInterceptor)
                .setAllowedOrigins(allowedOrigins);
    }
}
