package com.conversions.realtime.service;

/**
 * A notification payload could not be decoded into a change record.
 */
public class PayloadDecodeException extends RuntimeException {

    private final String channel;

    public PayloadDecodeException(String channel, String message) {
        super(message);
        this.channel = channel;
    }

    public PayloadDecodeException(String channel, String message, Throwable cause) {
        super(message, cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
