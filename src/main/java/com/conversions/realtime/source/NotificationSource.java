package com.conversions.realtime.source;

/**
 * Opens listening sessions against the change source. Each call returns a
 * fresh underlying connection.
 */
public interface NotificationSource {

    NotificationSession open();

    /**
     * Human readable description of the target, safe to log.
     */
    String describe();
}
