package com.conversions.realtime.service;

import com.conversions.realtime.model.ChangeMessage;
import com.conversions.realtime.model.ChangeRecord;
import com.conversions.realtime.model.ConnectionState;
import com.conversions.realtime.model.RawNotificationEvent;
import com.conversions.realtime.model.RoutingRule;
import com.conversions.realtime.source.ChangeSourceConnection;
import com.conversions.realtime.transport.FanoutSink;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Relays change notifications to clients: decode, route, fan out.
 *
 * <p>Each notification is fully handled on the listener thread before the next
 * one is read, so topics see notifications in source order. Nothing is queued
 * or retried here; a payload that fails to decode is counted and dropped.
 */
@Slf4j
@RequiredArgsConstructor
public class NotificationBridge {

    private final ChangeSourceConnection connection;
    private final NotificationDecoder decoder;
    private final RoutingTable routingTable;
    private final FanoutSink fanoutSink;
    private final BridgeMetrics metrics;

    public void start() {
        if (connection.start(this::onNotification)) {
            log.info("🚀 Notification bridge starting, channels: {}", connection.getChannels());
        }
    }

    public void stop() {
        log.info("🛑 Notification bridge stopping");
        connection.stop();
    }

    public ConnectionState getState() {
        return connection.getState();
    }

    void onNotification(RawNotificationEvent event) {
        metrics.recordReceived();
        log.debug("📨 Received notification on channel {}: {}", event.channelName(), event.rawPayload());

        ChangeRecord record;
        try {
            record = decoder.decode(event);
        } catch (PayloadDecodeException ex) {
            metrics.recordDropped();
            log.warn("❌ Dropping notification on channel {}: {}", ex.getChannel(), ex.getMessage());
            return;
        }

        Route route = routingTable.resolve(record);
        RoutingRule rule = route.rule();
        if (!route.declared()) {
            log.warn("🤷 Unknown notification channel {}, forwarding to topic of the same name", record.sourceChannel());
        }

        if (route.isGlobal()) {
            deliverToAll(rule, Map.of("message", record.document()));
            return;
        }
        ChangeMessage message = ChangeMessage.of(record, rule.kindLabel(), route.declared() ? null : record.sourceChannel());
        for (String topic : route.topics()) {
            deliver(topic, rule.eventName(), message);
        }
    }

    private void deliver(String topic, String eventName, Object payload) {
        try {
            fanoutSink.broadcastToTopic(topic, eventName, payload);
            metrics.recordBroadcast();
        } catch (RuntimeException ex) {
            metrics.recordBroadcastFailure();
            log.error("Broadcast of {} to topic {} failed", eventName, topic, ex);
        }
    }

    private void deliverToAll(RoutingRule rule, Object payload) {
        try {
            fanoutSink.broadcastToAll(rule.eventName(), payload);
            metrics.recordBroadcast();
        } catch (RuntimeException ex) {
            metrics.recordBroadcastFailure();
            log.error("Broadcast of {} to all clients failed", rule.eventName(), ex);
        }
    }
}
