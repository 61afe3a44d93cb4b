package com.conversions.realtime.source;

/**
 * Connection-level failure of the change source: opening, registering on,
 * polling or validating the listening connection.
 */
public class ChangeSourceException extends RuntimeException {

    public ChangeSourceException(String message) {
        super(message);
    }

    public ChangeSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
