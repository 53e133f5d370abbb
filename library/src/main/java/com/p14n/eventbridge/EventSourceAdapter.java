package com.p14n.eventbridge;

import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.eventbridge.broker.AsyncExecutor;
import com.p14n.eventbridge.broker.CommandSequencer;
import com.p14n.eventbridge.broker.EventBus;
import com.p14n.eventbridge.broker.EventQueue;
import com.p14n.eventbridge.data.DomainEvent;
import com.p14n.eventbridge.data.EventType;
import com.p14n.eventbridge.publish.EventPublisher;
import com.p14n.eventbridge.telemetry.BridgeMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drains the monitoring engine's event bus. Registers for every
 * {@link EventType} and, for each event received, enqueues a publish task on
 * the {@link CommandSequencer}. The loop never touches the store itself.
 */
public class EventSourceAdapter implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventSourceAdapter.class);

    private final EventBus bus;
    private final CommandSequencer sequencer;
    private final EventPublisher publisher;
    private final BridgeMetrics metrics;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private EventQueue queue;
    private Future<?> loop;

    public EventSourceAdapter(EventBus bus, CommandSequencer sequencer, EventPublisher publisher,
            BridgeMetrics metrics) {
        this.bus = bus;
        this.sequencer = sequencer;
        this.publisher = publisher;
        this.metrics = metrics;
    }

    /**
     * Registers on the bus and starts the loop. Events published after this
     * method returns are never missed.
     *
     * @param executor runs the loop
     */
    public void start(AsyncExecutor executor) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Already started");
        }
        queue = bus.subscribe(EventType.names());
        EventQueue events = queue;
        loop = executor.submit(() -> {
            drain(events);
            return null;
        });
    }

    private void drain(EventQueue events) {
        logger.atDebug().addArgument(events::types).log("Waiting for events of types {}");
        while (running.get()) {
            DomainEvent event;
            try {
                event = events.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            metrics.recordReceived(event.type());
            try {
                sequencer.enqueue(() -> publisher.publish(event));
            } catch (IllegalStateException e) {
                logger.atWarn().addArgument(event.type()).log("Command sequencer closed, dropping {} event");
            }
        }
        logger.atDebug().log("Event loop stopped");
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (queue != null) {
            queue.close();
        }
        if (loop != null) {
            loop.cancel(true);
        }
    }
}
