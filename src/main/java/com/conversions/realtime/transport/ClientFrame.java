package com.conversions.realtime.transport;

/**
 * JSON envelope exchanged with clients in both directions:
 * {@code {"event": "...", "data": ...}}.
 */
public record ClientFrame(String event, Object data) {

    public static final String CONNECTED = "connected";
    public static final String SUBSCRIBE = "subscribe";
    public static final String UNSUBSCRIBE = "unsubscribe";
    public static final String SUBSCRIPTION_SUCCESS = "subscription_success";
    public static final String UNSUBSCRIPTION_SUCCESS = "unsubscription_success";
    public static final String PING = "ping";
    public static final String PONG = "pong";
}
