package com.conversions.realtime.transport;

/**
 * Broadcast capability of the client transport. Delivery is fire-and-forget:
 * implementations hand the message to each member's connection and return
 * without waiting for it to be written.
 */
public interface FanoutSink {

    /**
     * Sends an event to every current member of a topic. A topic without
     * members is not an error.
     *
     * @param topic     target topic
     * @param eventName client event name
     * @param payload   event body, serialized as JSON
     */
    void broadcastToTopic(String topic, String eventName, Object payload);

    /**
     * Sends an event to every connected client regardless of subscriptions.
     */
    void broadcastToAll(String eventName, Object payload);
}
