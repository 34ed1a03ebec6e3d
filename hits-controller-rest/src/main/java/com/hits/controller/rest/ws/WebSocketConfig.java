package com.hits.controller.rest.ws;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final HitBroadcastHandler hitBroadcastHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(
            HitBroadcastHandler hitBroadcastHandler,
            @Value("${hits.ws.allowed-origins:*}") String[] allowedOrigins) {
        this.hitBroadcastHandler = hitBroadcastHandler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(hitBroadcastHandler, "/ws").setAllowedOrigins(allowedOrigins);
    }
}
