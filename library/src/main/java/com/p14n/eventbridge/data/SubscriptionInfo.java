package com.p14n.eventbridge.data;

import java.util.Set;

/**
 * A subscriber and the event types it wants delivered.
 */
public record SubscriptionInfo(String subscriberId, Set<String> eventTypes) {

    public SubscriptionInfo {
        if (subscriberId == null || subscriberId.isEmpty()) {
            throw new IllegalArgumentException("subscriberId cannot be null or empty");
        }
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
    }

    public boolean accepts(String eventType) {
        return eventTypes.contains(eventType);
    }
}
