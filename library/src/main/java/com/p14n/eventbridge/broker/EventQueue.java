package com.p14n.eventbridge.broker;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import com.p14n.eventbridge.data.DomainEvent;

/**
 * Unbounded queue of events registered on an {@link EventBus} for a fixed set
 * of event types. The bus fills it; a consumer loop drains it with
 * {@link #take()}.
 */
public class EventQueue implements MessageSubscriber<DomainEvent>, AutoCloseable {

    private final EventBus bus;
    private final Set<String> types;
    private final BlockingQueue<DomainEvent> events = new LinkedBlockingQueue<>();

    EventQueue(EventBus bus, Collection<String> types) {
        this.bus = bus;
        this.types = Set.copyOf(types);
    }

    @Override
    public void onMessage(DomainEvent message) {
        events.add(message);
    }

    /**
     * Waits for the next event.
     *
     * @return the next event
     * @throws InterruptedException if interrupted while waiting
     */
    public DomainEvent take() throws InterruptedException {
        return events.take();
    }

    /**
     * Waits up to the given time for the next event.
     *
     * @return the next event, or null on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public DomainEvent poll(long timeout, TimeUnit unit) throws InterruptedException {
        return events.poll(timeout, unit);
    }

    public Set<String> types() {
        return types;
    }

    public int size() {
        return events.size();
    }

    /**
     * Removes the queue from the bus. Events already queued stay available.
     */
    @Override
    public void close() {
        for (String type : types) {
            bus.unsubscribe(type, this);
        }
    }
}
