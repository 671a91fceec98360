package com.fixfinder.backend.realtime;

import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final RealtimeGateway realtimeGateway;
    private final SessionAuthInterceptor sessionAuthInterceptor;

    @Value("${app.realtime.allowed-origins:*}")
    private String allowedOrigins;

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(realtimeGateway, "/ws")
                .addInterceptors(sessionAuthInterceptor)
                .setAllowedOriginPatterns(allowedOrigins.split("\\s*,\\s*"));
    }
}
