package com.conversions.realtime.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client side of the relay: tracks sessions and their topic subscriptions.
 * Clients send {@code subscribe}/{@code unsubscribe} frames with a list of
 * topic names and receive change events for the topics they joined.
 */
@Slf4j
public class RealtimeWebSocketHandler extends TextWebSocketHandler {

    public static final String SERVER_NAME = "realtime-relay-v1.0.0";

    private final ClientSessions clientSessions;
    private final SubscriptionRegistry registry;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RealtimeWebSocketHandler(ClientSessions clientSessions, SubscriptionRegistry registry,
                                    ObjectMapper objectMapper, Clock clock) {
        this.clientSessions = clientSessions;
        this.registry = registry;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String id = session.getId();
        clientSessions.add(session);
        registry.register(id);
        log.info("🔌 Client connected: {}", id);

        Map<String, Object> hello = new LinkedHashMap<>();
        hello.put("id", id);
        hello.put("timestamp", now());
        hello.put("server", SERVER_NAME);
        clientSessions.send(id, clientSessions.encode(ClientFrame.CONNECTED, hello));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String id = session.getId();
        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException ex) {
            log.warn("Ignoring malformed frame from client {}: {}", id, ex.getOriginalMessage());
            return;
        }
        if (frame == null || !frame.isObject()) {
            log.warn("Ignoring non-object frame from client {}", id);
            return;
        }

        String event = frame.path("event").asText("");
        switch (event) {
            case ClientFrame.SUBSCRIBE -> subscribe(id, topics(frame.get("data")));
            case ClientFrame.UNSUBSCRIBE -> unsubscribe(id, topics(frame.get("data")));
            case ClientFrame.PING -> clientSessions.send(id,
                    clientSessions.encode(ClientFrame.PONG, Map.of("timestamp", now())));
            default -> log.debug("Ignoring unknown event '{}' from client {}", event, id);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error for client {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String id = session.getId();
        registry.unregister(id);
        clientSessions.remove(id);
        log.info("🔌 Client disconnected: {}, reason: {}", id, status);
    }

    private void subscribe(String id, List<String> topics) {
        log.info("📡 Client {} subscribing to: {}", id, topics);
        topics.forEach(topic -> registry.join(id, topic));
        clientSessions.send(id, clientSessions.encode(ClientFrame.SUBSCRIPTION_SUCCESS, confirmation(topics)));
    }

    private void unsubscribe(String id, List<String> topics) {
        log.info("📡 Client {} unsubscribing from: {}", id, topics);
        topics.forEach(topic -> registry.leave(id, topic));
        clientSessions.send(id, clientSessions.encode(ClientFrame.UNSUBSCRIPTION_SUCCESS, confirmation(topics)));
    }

    private Map<String, Object> confirmation(List<String> topics) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("channels", topics);
        body.put("timestamp", now());
        return body;
    }

    /**
     * Accepts a JSON array of names or a single name; blank entries are skipped.
     */
    private static List<String> topics(JsonNode data) {
        List<String> topics = new ArrayList<>();
        if (data == null || data.isNull()) {
            return topics;
        }
        if (data.isTextual()) {
            addTopic(topics, data.asText());
        } else if (data.isArray()) {
            data.forEach(item -> {
                if (item.isValueNode() && !item.isNull()) {
                    addTopic(topics, item.asText());
                }
            });
        }
        return topics;
    }

    private static void addTopic(List<String> topics, String topic) {
        if (!topic.isBlank() && !topics.contains(topic)) {
            topics.add(topic);
        }
    }

    private String now() {
        return clock.instant().toString();
    }
}
