package com.conversions.realtime.model;

/**
 * Row-level operation reported by a database change notification.
 */
public enum ChangeOperation {
    INSERT,
    UPDATE,
    DELETE,
    UNKNOWN;

    /**
     * Maps the {@code operation} field of a notification payload. Missing or
     * unrecognised values map to {@link #UNKNOWN} so the record is still routed.
     */
    public static ChangeOperation fromPayload(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        try {
            return ChangeOperation.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException ex) {
            return UNKNOWN;
        }
    }
}
