package com.conversions.realtime.service;

import com.conversions.realtime.model.RoutingRule;

import java.util.Set;

/**
 * Delivery decision for one change record.
 *
 * @param rule     the rule that matched, or the pass-through rule
 * @param topics   topics to broadcast to, in deterministic order; empty for global delivery
 * @param declared whether {@code rule} came from the routing table rather than the fallback
 */
public record Route(RoutingRule rule, Set<String> topics, boolean declared) {

    public boolean isGlobal() {
        return rule.delivery() == RoutingRule.Delivery.ALL_CLIENTS;
    }
}
