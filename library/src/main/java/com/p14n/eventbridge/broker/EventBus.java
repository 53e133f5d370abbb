package com.p14n.eventbridge.broker;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.eventbridge.data.DomainEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process event bus of the monitoring engine. Topics are event type names;
 * an event is delivered only to subscribers of its own type.
 *
 * <p>
 * Delivery is synchronous on the publishing thread, so subscribers must hand
 * the event off quickly. {@link EventQueue} does exactly that.
 * </p>
 */
public class EventBus implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, Set<MessageSubscriber<DomainEvent>>> topicSubscribers = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private boolean canProcess(String topic, DomainEvent message) {
        if (closed.get()) {
            throw new IllegalStateException("Event bus is closed");
        }

        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }

        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        Set<MessageSubscriber<DomainEvent>> subscribers = topicSubscribers.get(topic);
        return subscribers != null && !subscribers.isEmpty();
    }

    /**
     * Publishes an event under its own type.
     *
     * @param event the event
     */
    public void publish(DomainEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        publish(event.type(), event);
    }

    /**
     * Delivers an event to the subscribers of a topic. Does nothing if the
     * topic has none.
     *
     * @param topic   the event type name
     * @param message the event
     */
    public void publish(String topic, DomainEvent message) {
        if (!canProcess(topic, message)) {
            return;
        }

        Set<MessageSubscriber<DomainEvent>> subscribers = topicSubscribers.get(topic);
        if (subscribers == null) {
            return;
        }
        for (MessageSubscriber<DomainEvent> subscriber : subscribers) {
            try {
                subscriber.onMessage(message);
            } catch (RuntimeException e) {
                logger.atWarn().setCause(e).addArgument(topic).log("Subscriber failed to accept {} event");
                subscriber.onError(e);
            }
        }
    }

    /**
     * @return true if added, false if the subscriber was already registered
     */
    public boolean subscribe(String topic, MessageSubscriber<DomainEvent> subscriber) {
        if (closed.get()) {
            throw new IllegalStateException("Event bus is closed");
        }

        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }

        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        return topicSubscribers
                .computeIfAbsent(topic, k -> new CopyOnWriteArraySet<>())
                .add(subscriber);
    }

    /**
     * Creates a queue that receives every event whose type is in the given set.
     *
     * @param types the event type names to receive
     * @return the registered queue
     */
    public EventQueue subscribe(Collection<String> types) {
        if (types == null || types.isEmpty()) {
            throw new IllegalArgumentException("Types cannot be null or empty");
        }
        EventQueue queue = new EventQueue(this, types);
        for (String type : types) {
            subscribe(type, queue);
        }
        return queue;
    }

    /**
     * @return true if removed, false if the subscriber was not registered
     */
    public boolean unsubscribe(String topic, MessageSubscriber<DomainEvent> subscriber) {
        if (subscriber == null) {
            throw new IllegalArgumentException("Subscriber cannot be null");
        }

        if (topic == null) {
            throw new IllegalArgumentException("Topic cannot be null");
        }

        Set<MessageSubscriber<DomainEvent>> subscribers = topicSubscribers.get(topic);
        if (subscribers == null) {
            return false;
        }
        boolean removed = subscribers.remove(subscriber);
        if (subscribers.isEmpty()) {
            topicSubscribers.remove(topic);
        }
        return removed;
    }

    @Override
    public void close() {
        closed.set(true);
        topicSubscribers.clear();
    }
}
