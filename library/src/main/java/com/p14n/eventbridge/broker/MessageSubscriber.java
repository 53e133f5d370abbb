package com.p14n.eventbridge.broker;

/**
 * Receives events from an {@link EventBus} on the publishing thread.
 *
 * @param <T> event type
 */
public interface MessageSubscriber<T> {

    void onMessage(T message);

    /**
     * Told about an exception {@link #onMessage} threw. The bus has already
     * logged it and carries on with the other subscribers.
     *
     * @param error what {@link #onMessage} threw
     */
    default void onError(Throwable error) {
    }
}
