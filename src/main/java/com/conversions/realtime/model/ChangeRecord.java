package com.conversions.realtime.model;

import java.util.Map;

/**
 * Decoded form of a change notification.
 *
 * @param operation     row operation, {@link ChangeOperation#UNKNOWN} when absent or unrecognised
 * @param entityKind    the {@code table} field of the payload, or {@code null} when absent
 * @param entityData    the {@code data} object of the payload; empty when absent
 * @param sourceChannel channel the notification arrived on
 * @param document      the whole decoded payload
 */
public record ChangeRecord(
        ChangeOperation operation,
        String entityKind,
        Map<String, Object> entityData,
        String sourceChannel,
        Map<String, Object> document
) {

    public Object field(String name) {
        return entityData.get(name);
    }
}
