package com.conversions.realtime.controller;

import com.conversions.realtime.service.RelayStatusService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only status endpoints.
 */
@RestController
@RequiredArgsConstructor
public class StatusController {

    private final RelayStatusService statusService;

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(statusService.health());
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> stats() {
        return ResponseEntity.ok(statusService.stats());
    }

    @GetMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics() {
        return ResponseEntity.ok(statusService.metrics());
    }

    @GetMapping("/channels")
    public ResponseEntity<Map<String, Object>> channels() {
        return ResponseEntity.ok(statusService.channels());
    }

    /**
     * Static description of the service
     */
    @GetMapping({"/", "/info"})
    public ResponseEntity<Map<String, Object>> info() {
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("name", "Realtime Relay");
        info.put("version", RelayStatusService.VERSION);
        info.put("description", "Relays database change notifications to WebSocket clients by topic");
        info.put("endpoints", Map.of(
                "health", "/health",
                "stats", "/stats",
                "metrics", "/metrics",
                "channels", "/channels"));
        info.put("websocket", Map.of(
                "transports", List.of("websocket", "sockjs"),
                "cors", "enabled"));
        return ResponseEntity.ok(info);
    }
}
