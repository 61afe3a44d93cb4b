package com.conversions.realtime.config;

import com.conversions.realtime.service.BridgeMetrics;
import com.conversions.realtime.service.NotificationBridge;
import com.conversions.realtime.service.NotificationDecoder;
import com.conversions.realtime.service.RoutingTable;
import com.conversions.realtime.source.ChangeSourceConnection;
import com.conversions.realtime.source.NotificationSource;
import com.conversions.realtime.source.PgConnectionUrl;
import com.conversions.realtime.source.PgNotificationSource;
import com.conversions.realtime.transport.ClientSessions;
import com.conversions.realtime.transport.FanoutSink;
import com.conversions.realtime.transport.SubscriptionRegistry;
import com.conversions.realtime.transport.WebSocketFanoutSink;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.util.backoff.BackOff;
import org.springframework.util.backoff.ExponentialBackOff;
import org.springframework.util.backoff.FixedBackOff;

import java.time.Clock;
import java.util.concurrent.Executors;

/**
 * Wires the notification bridge: source connection, decoder, routing table and
 * the WebSocket fanout sink.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RealtimeProperties.class)
public class RelayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RoutingTable routingTable() {
        return RoutingTable.defaults();
    }

    @Bean
    public NotificationSource notificationSource(RealtimeProperties properties, Clock clock) {
        PgConnectionUrl url = PgConnectionUrl.parse(properties.getDatabaseUrl());
        log.info("Change source: {}", PgConnectionUrl.mask(properties.getDatabaseUrl()));
        return new PgNotificationSource(url, properties.getValidationInterval(), clock);
    }

    @Bean
    public BackOff reconnectBackOff(RealtimeProperties properties) {
        RealtimeProperties.Reconnect reconnect = properties.getReconnect();
        long delay = reconnect.getDelay().toMillis();
        if (reconnect.getPolicy() == RealtimeProperties.ReconnectPolicy.EXPONENTIAL) {
            ExponentialBackOff backOff = new ExponentialBackOff(delay, reconnect.getMultiplier());
            backOff.setMaxInterval(reconnect.getMaxDelay().toMillis());
            return backOff;
        }
        return new FixedBackOff(delay, FixedBackOff.UNLIMITED_ATTEMPTS);
    }

    @Bean(destroyMethod = "close")
    public ChangeSourceConnection changeSourceConnection(NotificationSource notificationSource,
                                                        RoutingTable routingTable,
                                                        BackOff reconnectBackOff,
                                                        RealtimeProperties properties) {
        CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("pg-listener-");
        threadFactory.setDaemon(true);
        return new ChangeSourceConnection(
                notificationSource,
                routingTable.channels(),
                reconnectBackOff,
                properties.getPollTimeout(),
                Executors.newSingleThreadScheduledExecutor(threadFactory));
    }

    @Bean
    public SubscriptionRegistry subscriptionRegistry() {
        return new SubscriptionRegistry();
    }

    @Bean
    public ClientSessions clientSessions(ObjectMapper objectMapper, RealtimeProperties properties) {
        RealtimeProperties.WebSocket websocket = properties.getWebsocket();
        return new ClientSessions(objectMapper,
                (int) websocket.getSendTimeLimit().toMillis(),
                (int) websocket.getBufferSizeLimit().toBytes());
    }

    @Bean
    public FanoutSink fanoutSink(ClientSessions clientSessions, SubscriptionRegistry subscriptionRegistry) {
        return new WebSocketFanoutSink(clientSessions, subscriptionRegistry);
    }

    @Bean
    public BridgeMetrics bridgeMetrics(MeterRegistry meterRegistry, ChangeSourceConnection changeSourceConnection) {
        return new BridgeMetrics(meterRegistry, changeSourceConnection);
    }

    @Bean(destroyMethod = "stop")
    public NotificationBridge notificationBridge(ChangeSourceConnection changeSourceConnection,
                                                 ObjectMapper objectMapper,
                                                 RoutingTable routingTable,
                                                 FanoutSink fanoutSink,
                                                 BridgeMetrics bridgeMetrics) {
        return new NotificationBridge(changeSourceConnection, new NotificationDecoder(objectMapper),
                routingTable, fanoutSink, bridgeMetrics);
    }
}
