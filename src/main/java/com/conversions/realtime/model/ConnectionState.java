package com.conversions.realtime.model;

/**
 * Lifecycle of the single listening connection to the change source.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    LISTENING,
    DEGRADED
}
