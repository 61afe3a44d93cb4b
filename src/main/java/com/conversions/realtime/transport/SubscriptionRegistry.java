package com.conversions.realtime.transport;

import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Topic membership of connected sessions, indexed both ways. Join and leave
 * are idempotent. Per-topic updates go through {@link ConcurrentHashMap#compute},
 * so a topic entry is dropped exactly when its last member leaves and a
 * concurrent join never lands in a discarded set.
 */
@Slf4j
public class SubscriptionRegistry {

    private final Map<String, Set<String>> membersByTopic = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> topicsBySession = new ConcurrentHashMap<>();

    public void register(String sessionId) {
        topicsBySession.putIfAbsent(sessionId, ConcurrentHashMap.newKeySet());
    }

    /**
     * @return {@code true} if the session was not yet a member
     */
    public boolean join(String sessionId, String topic) {
        Set<String> sessionTopics = topicsBySession.get(sessionId);
        if (sessionTopics == null) {
            log.debug("Ignoring join of unknown session {} to {}", sessionId, topic);
            return false;
        }
        sessionTopics.add(topic);
        boolean[] added = new boolean[1];
        membersByTopic.compute(topic, (key, members) -> {
            Set<String> target = members != null ? members : ConcurrentHashMap.newKeySet();
            added[0] = target.add(sessionId);
            return target;
        });
        if (topicsBySession.get(sessionId) != sessionTopics) {
            // unregistered while joining
            removeMember(topic, sessionId);
            return false;
        }
        return added[0];
    }

    /**
     * @return {@code true} if the session was a member
     */
    public boolean leave(String sessionId, String topic) {
        Set<String> sessionTopics = topicsBySession.get(sessionId);
        if (sessionTopics != null) {
            sessionTopics.remove(topic);
        }
        return removeMember(topic, sessionId);
    }

    /**
     * Removes the session and all its memberships.
     */
    public void unregister(String sessionId) {
        Set<String> sessionTopics = topicsBySession.remove(sessionId);
        if (sessionTopics == null) {
            return;
        }
        for (String topic : sessionTopics) {
            removeMember(topic, sessionId);
        }
    }

    /**
     * Snapshot of the members of a topic.
     */
    public Set<String> members(String topic) {
        Set<String> members = membersByTopic.get(topic);
        return members == null ? Collections.emptySet() : Set.copyOf(members);
    }

    public Set<String> topics(String sessionId) {
        Set<String> topics = topicsBySession.get(sessionId);
        return topics == null ? Collections.emptySet() : Set.copyOf(topics);
    }

    /**
     * Snapshot of topic to member count, sorted by topic name.
     */
    public Map<String, Integer> memberCounts() {
        Map<String, Integer> counts = new TreeMap<>();
        membersByTopic.forEach((topic, members) -> {
            int size = members.size();
            if (size > 0) {
                counts.put(topic, size);
            }
        });
        return counts;
    }

    public int sessionCount() {
        return topicsBySession.size();
    }

    private boolean removeMember(String topic, String sessionId) {
        boolean[] removed = new boolean[1];
        membersByTopic.computeIfPresent(topic, (key, members) -> {
            removed[0] = members.remove(sessionId);
            return members.isEmpty() ? null : members;
        });
        return removed[0];
    }
}
