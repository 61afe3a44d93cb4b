package com.conversions.realtime.model;

/**
 * Routing descriptor for one notification channel.
 *
 * @param channel            channel name this rule applies to
 * @param kindLabel          entity label sent to clients as {@code table}
 * @param staticTopic        topic every record of this channel goes to, {@code null} for global rules
 * @param derivedTopicField  entity field holding the owning id, {@code null} when the kind has none
 * @param derivedTopicPrefix prefix prepended to the owning id to form the derived topic
 * @param eventName          client event name used for delivery
 * @param delivery           whether the message goes to topics or to every connected client
 */
public record RoutingRule(
        String channel,
        String kindLabel,
        String staticTopic,
        String derivedTopicField,
        String derivedTopicPrefix,
        String eventName,
        Delivery delivery
) {

    public static final String CHANGE_EVENT = "postgres_changes";

    public enum Delivery {
        TOPICS,
        ALL_CLIENTS
    }

    public static RoutingRule topic(String channel, String kindLabel, String staticTopic) {
        return new RoutingRule(channel, kindLabel, staticTopic, null, null, CHANGE_EVENT, Delivery.TOPICS);
    }

    public static RoutingRule scoped(String channel, String kindLabel, String staticTopic,
                                     String derivedTopicField, String derivedTopicPrefix) {
        return new RoutingRule(channel, kindLabel, staticTopic, derivedTopicField, derivedTopicPrefix,
                CHANGE_EVENT, Delivery.TOPICS);
    }

    public static RoutingRule allClients(String channel, String kindLabel, String eventName) {
        return new RoutingRule(channel, kindLabel, null, null, null, eventName, Delivery.ALL_CLIENTS);
    }

    /**
     * Rule used for channels without a declared rule: the channel name doubles as the topic.
     */
    public static RoutingRule passThrough(String channel, String kindLabel) {
        return new RoutingRule(channel, kindLabel, channel, null, null, CHANGE_EVENT, Delivery.TOPICS);
    }

    public boolean hasDerivedTopic() {
        return derivedTopicField != null;
    }
}
