package com.conversions.realtime.source;

import com.conversions.realtime.model.RawNotificationEvent;

import java.time.Duration;
import java.util.List;
import java.util.Set;

/**
 * One live connection to the change source.
 */
public interface NotificationSession extends AutoCloseable {

    /**
     * Registers interest in all the given channels. Fails as a whole if any
     * single registration fails.
     */
    void listen(Set<String> channels);

    /**
     * Waits up to {@code timeout} for notifications and returns them in arrival
     * order; an empty list when none arrived.
     *
     * @throws ChangeSourceException when the connection is broken
     */
    List<RawNotificationEvent> poll(Duration timeout);

    /**
     * Releases the connection. Never throws.
     */
    @Override
    void close();
}
