package com.conversions.realtime.service;

import com.conversions.realtime.source.ChangeSourceConnection;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Micrometer counters for the notification pipeline.
 */
public class BridgeMetrics {

    private final Counter receivedCounter;
    private final Counter droppedCounter;
    private final Counter broadcastCounter;
    private final Counter broadcastFailedCounter;
    private final ChangeSourceConnection connection;

    public BridgeMetrics(MeterRegistry meterRegistry, ChangeSourceConnection connection) {
        this.connection = connection;
        this.receivedCounter = meterRegistry.counter("relay.notifications.received");
        this.droppedCounter = meterRegistry.counter("relay.notifications.dropped");
        this.broadcastCounter = meterRegistry.counter("relay.broadcasts.sent");
        this.broadcastFailedCounter = meterRegistry.counter("relay.broadcasts.failed");
        FunctionCounter.builder("relay.reconnect.attempts", connection, ChangeSourceConnection::getReconnectAttempts)
                .register(meterRegistry);
        Gauge.builder("relay.connection.state", connection, c -> c.getState().ordinal())
                .description("0=DISCONNECTED 1=CONNECTING 2=LISTENING 3=DEGRADED")
                .register(meterRegistry);
    }

    public void recordReceived() {
        receivedCounter.increment();
    }

    public void recordDropped() {
        droppedCounter.increment();
    }

    public void recordBroadcast() {
        broadcastCounter.increment();
    }

    public void recordBroadcastFailure() {
        broadcastFailedCounter.increment();
    }

    public long getReceivedCount() {
        return (long) receivedCounter.count();
    }

    public long getDroppedCount() {
        return (long) droppedCounter.count();
    }

    public long getBroadcastCount() {
        return (long) broadcastCounter.count();
    }

    public long getBroadcastFailureCount() {
        return (long) broadcastFailedCounter.count();
    }

    public long getReconnectAttempts() {
        return connection.getReconnectAttempts();
    }
}
