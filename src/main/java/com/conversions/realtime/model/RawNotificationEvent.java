package com.conversions.realtime.model;

import java.time.Instant;

/**
 * A notification exactly as it arrived from the change source.
 *
 * @param channelName channel the notification was published on
 * @param rawPayload  payload text, may be empty
 * @param receivedAt  time the listener picked it up
 */
public record RawNotificationEvent(
        String channelName,
        String rawPayload,
        Instant receivedAt
) { }
