package com.p14n.eventbridge.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Record representing an event emitted by the monitoring engine.
 * The attribute map is copied on creation and never changes afterwards.
 */
public record DomainEvent(String type,
                          Map<String, Object> attributes,
                          String traceparent) implements Traceable {

    public DomainEvent {
        if (type == null || type.trim().isEmpty()) {
            throw new IllegalArgumentException("type cannot be null or empty");
        }
        attributes = attributes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static DomainEvent create(String type, Map<String, Object> attributes) {
        return new DomainEvent(type, attributes, null);
    }

    public static DomainEvent create(EventType type, Map<String, Object> attributes) {
        return new DomainEvent(type.name(), attributes, null);
    }

    @Override
    public String topic() {
        return type;
    }

    /**
     * Identifies the monitored object as {@code host} or {@code host!service}.
     *
     * @return the subject, or an empty string if the event names no host
     */
    @Override
    public String subject() {
        Object host = attributes.get("host");
        if (host == null) {
            return "";
        }
        Object service = attributes.get("service");
        return service == null ? host.toString() : host + "!" + service;
    }
}
