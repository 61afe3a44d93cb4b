package com.conversions.realtime.config;

import com.conversions.realtime.service.NotificationBridge;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts listening to the change source once the transport is accepting clients.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "realtime.bridge.enabled", havingValue = "true", matchIfMissing = true)
public class BridgeStarter {

    private final NotificationBridge bridge;

    @EventListener(ApplicationReadyEvent.class)
    public void startBridge() {
        log.info("Application ready, starting notification bridge");
        bridge.start();
    }
}
