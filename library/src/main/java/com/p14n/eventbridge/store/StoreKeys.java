package com.p14n.eventbridge.store;

/**
 * Key layout shared with the consumers reading from the store.
 */
public class StoreKeys {

    private final String prefix;

    public StoreKeys(String prefix) {
        if (prefix == null || prefix.isEmpty()) {
            throw new IllegalArgumentException("Key prefix cannot be null or empty");
        }
        this.prefix = prefix;
    }

    /** Counter handing out event indexes. */
    public String eventIndex() {
        return prefix + ":event.idx";
    }

    /** Body of the event with the given index. */
    public String event(long index) {
        return prefix + ":event." + index;
    }

    /** Delivery list of one subscriber. */
    public String subscriberList(String subscriberId) {
        return prefix + ":event:" + subscriberId;
    }

    /** Hash of subscriber id to filter record. */
    public String subscriptions() {
        return prefix + ":subscription";
    }
}
