package com.conversions.realtime.service;

import com.conversions.realtime.model.ChangeRecord;
import com.conversions.realtime.model.RoutingRule;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps change records to broadcast topics by looking up the record's source
 * channel in a table of {@link RoutingRule}s. Channels without a rule are
 * passed through to the topic of the same name.
 */
public final class RoutingTable {

    public static final String CONVERSION_MESSAGE_CHANNEL = "conversion_message_changes";
    public static final String CONVERSION_CHANNEL = "conversion_changes";
    public static final String CONVERSION_STEP_CHANNEL = "conversion_step_changes";
    public static final String TEST_CHANNEL = "test_channel";

    private static final String UNKNOWN_KIND = "unknown";

    private final Map<String, RoutingRule> rules;

    public RoutingTable(Collection<RoutingRule> rules) {
        Map<String, RoutingRule> byChannel = new LinkedHashMap<>();
        for (RoutingRule rule : rules) {
            if (byChannel.putIfAbsent(rule.channel(), rule) != null) {
                throw new IllegalArgumentException("Duplicate routing rule for channel " + rule.channel());
            }
        }
        this.rules = Collections.unmodifiableMap(byChannel);
    }

    /**
     * The rules of the conversion domain: conversions, their steps and
     * messages, and the diagnostic test channel.
     */
    public static RoutingTable defaults() {
        return new RoutingTable(List.of(
                RoutingRule.scoped(CONVERSION_MESSAGE_CHANNEL, "ConversionMessage", "conversion-messages",
                        "conversionId", "conversion-"),
                RoutingRule.topic(CONVERSION_CHANNEL, "Conversion", "conversions"),
                RoutingRule.scoped(CONVERSION_STEP_CHANNEL, "ConversionStep", "conversion-steps",
                        "conversionId", "conversion-"),
                RoutingRule.allClients(TEST_CHANNEL, "test", "test_notification")));
    }

    /**
     * Channels with a declared rule; these are the channels to listen on.
     */
    public Set<String> channels() {
        return rules.keySet();
    }

    public Route resolve(ChangeRecord record) {
        RoutingRule rule = rules.get(record.sourceChannel());
        if (rule == null) {
            String kind = record.entityKind() != null ? record.entityKind() : UNKNOWN_KIND;
            RoutingRule fallback = RoutingRule.passThrough(record.sourceChannel(), kind);
            return new Route(fallback, Collections.singleton(record.sourceChannel()), false);
        }
        return new Route(rule, topicsFor(rule, record), true);
    }

    public Set<String> topicsFor(ChangeRecord record) {
        return resolve(record).topics();
    }

    private static Set<String> topicsFor(RoutingRule rule, ChangeRecord record) {
        if (rule.delivery() == RoutingRule.Delivery.ALL_CLIENTS) {
            return Collections.emptySet();
        }
        Set<String> topics = new LinkedHashSet<>();
        topics.add(rule.staticTopic());
        if (rule.hasDerivedTopic()) {
            String ownerId = ownerId(record.field(rule.derivedTopicField()));
            if (ownerId != null) {
                topics.add(rule.derivedTopicPrefix() + ownerId);
            }
        }
        return Collections.unmodifiableSet(topics);
    }

    private static String ownerId(Object value) {
        if (value == null) {
            return null;
        }
        String id = String.valueOf(value);
        return id.isBlank() ? null : id;
    }
}
