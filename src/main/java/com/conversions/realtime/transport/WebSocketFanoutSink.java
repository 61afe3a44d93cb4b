package com.conversions.realtime.transport;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.TextMessage;

import java.util.Set;

/**
 * {@link FanoutSink} over the WebSocket sessions. The frame is serialized once
 * per broadcast and handed to every member's session.
 */
@Slf4j
@RequiredArgsConstructor
public class WebSocketFanoutSink implements FanoutSink {

    private final ClientSessions clientSessions;
    private final SubscriptionRegistry registry;

    @Override
    public void broadcastToTopic(String topic, String eventName, Object payload) {
        Set<String> members = registry.members(topic);
        if (members.isEmpty()) {
            log.debug("No subscribers for topic {}, skipping {}", topic, eventName);
            return;
        }
        TextMessage message = clientSessions.encode(eventName, payload);
        int delivered = 0;
        for (String sessionId : members) {
            if (clientSessions.send(sessionId, message)) {
                delivered++;
            }
        }
        log.debug("Broadcast {} to topic {} ({}/{} clients)", eventName, topic, delivered, members.size());
    }

    @Override
    public void broadcastToAll(String eventName, Object payload) {
        int delivered = clientSessions.sendToAll(clientSessions.encode(eventName, payload));
        log.debug("Broadcast {} to all clients ({})", eventName, delivered);
    }
}
