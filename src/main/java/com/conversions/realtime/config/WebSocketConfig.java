package com.conversions.realtime.config;

import com.conversions.realtime.transport.ClientSessions;
import com.conversions.realtime.transport.RealtimeWebSocketHandler;
import com.conversions.realtime.transport.SubscriptionRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

import java.time.Clock;

@Configuration
@EnableWebSocket
@RequiredArgsConstructor
public class WebSocketConfig implements WebSocketConfigurer {

    private final RealtimeProperties properties;
    private final ClientSessions clientSessions;
    private final SubscriptionRegistry subscriptionRegistry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Bean
    public RealtimeWebSocketHandler realtimeWebSocketHandler() {
        return new RealtimeWebSocketHandler(clientSessions, subscriptionRegistry, objectMapper, clock);
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        RealtimeProperties.WebSocket websocket = properties.getWebsocket();
        String[] origins = websocket.getAllowedOrigins().toArray(String[]::new);
        registry.addHandler(realtimeWebSocketHandler(), websocket.getPath())
                .setAllowedOriginPatterns(origins);
        registry.addHandler(realtimeWebSocketHandler(), websocket.getSockJsPath())
                .setAllowedOriginPatterns(origins)
                .withSockJS();
    }
}
