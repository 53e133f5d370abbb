package com.p14n.eventbridge.data;

import java.time.Duration;

/**
 * The stored form of a {@link DomainEvent}: the index handed out by the store's
 * counter, the JSON body and the time the body is kept for.
 */
public record EventRecord(long index, String body, Duration ttl) {

    public EventRecord {
        if (index <= 0) {
            throw new IllegalArgumentException("index must be positive");
        }
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
    }
}
