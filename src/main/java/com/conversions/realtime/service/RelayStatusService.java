package com.conversions.realtime.service;

import com.conversions.realtime.model.ConnectionState;
import com.conversions.realtime.transport.ClientSessions;
import com.conversions.realtime.transport.SubscriptionRegistry;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeSet;

/**
 * Read-only snapshots of relay state for the HTTP status endpoints.
 */
@Service
public class RelayStatusService {

    public static final String SERVICE_NAME = "realtime-relay";
    public static final String VERSION = "1.0.0";

    private final ClientSessions clientSessions;
    private final SubscriptionRegistry registry;
    private final NotificationBridge bridge;
    private final BridgeMetrics metrics;
    private final Clock clock;
    private final Instant startedAt;

    public RelayStatusService(ClientSessions clientSessions,
                              SubscriptionRegistry registry,
                              NotificationBridge bridge,
                              BridgeMetrics metrics,
                              Clock clock) {
        this.clientSessions = clientSessions;
        this.registry = registry;
        this.bridge = bridge;
        this.metrics = metrics;
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public int connectedClients() {
        return clientSessions.count();
    }

    public Map<String, Integer> clientsPerTopic() {
        return registry.memberCounts();
    }

    /**
     * Seconds since the service started.
     */
    public double uptimeSeconds() {
        return Duration.between(startedAt, clock.instant()).toMillis() / 1000.0;
    }

    public ConnectionState connectionState() {
        return bridge.getState();
    }

    public Map<String, Object> health() {
        ConnectionState state = connectionState();
        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", state == ConnectionState.LISTENING ? "healthy" : "degraded");
        health.put("timestamp", now());
        health.put("connectedClients", connectedClients());
        health.put("uptime", uptimeSeconds());
        health.put("version", VERSION);
        health.put("service", SERVICE_NAME);
        health.put("connectionState", state);
        return health;
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("connectedClients", connectedClients());
        stats.put("rooms", clientsPerTopic().keySet());
        stats.put("uptime", uptimeSeconds());
        stats.put("timestamp", now());
        return stats;
    }

    public Map<String, Object> metrics() {
        Map<String, Integer> perTopic = clientsPerTopic();
        Runtime runtime = Runtime.getRuntime();
        Map<String, Object> memory = new LinkedHashMap<>();
        memory.put("heapUsed", runtime.totalMemory() - runtime.freeMemory());
        memory.put("heapMax", runtime.maxMemory());
        memory.put("totalMemory", runtime.totalMemory());
        memory.put("freeMemory", runtime.freeMemory());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("totalClients", connectedClients());
        result.put("totalRooms", perTopic.size());
        result.put("clientsPerRoom", perTopic);
        result.put("uptime", uptimeSeconds());
        result.put("memoryUsage", memory);
        result.put("javaVersion", System.getProperty("java.version"));
        result.put("notificationsReceived", metrics.getReceivedCount());
        result.put("notificationsDropped", metrics.getDroppedCount());
        result.put("broadcastsSent", metrics.getBroadcastCount());
        result.put("broadcastsFailed", metrics.getBroadcastFailureCount());
        result.put("reconnectAttempts", metrics.getReconnectAttempts());
        result.put("connectionState", connectionState());
        result.put("timestamp", now());
        return result;
    }

    public Map<String, Object> channels() {
        Map<String, Object> channels = new LinkedHashMap<>();
        clientsPerTopic().forEach((topic, count) -> {
            Map<String, Object> channel = new LinkedHashMap<>();
            channel.put("name", topic);
            channel.put("clientCount", count);
            channel.put("clients", new TreeSet<>(registry.members(topic)));
            channels.put(topic, channel);
        });

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("totalChannels", channels.size());
        result.put("channels", channels);
        result.put("timestamp", now());
        return result;
    }

    private String now() {
        return clock.instant().toString();
    }
}
