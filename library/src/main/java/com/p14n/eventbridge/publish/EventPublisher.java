package com.p14n.eventbridge.publish;

import java.time.Duration;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.p14n.eventbridge.data.DomainEvent;
import com.p14n.eventbridge.data.EventRecord;
import com.p14n.eventbridge.store.ConnectionSupervisor;
import com.p14n.eventbridge.store.StoreCommand;
import com.p14n.eventbridge.store.StoreException;
import com.p14n.eventbridge.store.StoreKeys;
import com.p14n.eventbridge.store.StoreReply;
import com.p14n.eventbridge.subscription.SubscriptionRegistry;
import com.p14n.eventbridge.telemetry.BridgeMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import static com.p14n.eventbridge.telemetry.OpenTelemetryFunctions.processWithTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one event to the store and hands its index to every interested
 * subscriber.
 *
 * <p>
 * The steps run in this order:
 * </p>
 * <ol>
 * <li>{@code INCR <prefix>:event.idx} allocates the index</li>
 * <li>{@code SET <prefix>:event.<index> <body>} then
 * {@code EXPIRE <prefix>:event.<index> <ttl>} store the body</li>
 * <li>{@code LPUSH <prefix>:event:<subscriber> <index>} for each subscriber
 * whose filter contains the event type</li>
 * </ol>
 *
 * <p>
 * A subscriber list never references a body that has not been written. The
 * first failing command drops the connection and abandons the event; an index
 * already allocated is not reused and subscribers already pushed to keep their
 * entry. Delivery is at most once.
 * </p>
 *
 * <p>
 * {@link #publish(DomainEvent)} must run on the
 * {@link com.p14n.eventbridge.broker.CommandSequencer} worker.
 * </p>
 */
public class EventPublisher {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisher.class);

    private final ConnectionSupervisor supervisor;
    private final SubscriptionRegistry registry;
    private final StoreKeys keys;
    private final Duration ttl;
    private final EventEncoder encoder;
    private final BridgeMetrics metrics;
    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;

    public EventPublisher(ConnectionSupervisor supervisor, SubscriptionRegistry registry, StoreKeys keys,
            Duration ttl, EventEncoder encoder, BridgeMetrics metrics, OpenTelemetry ot) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        this.supervisor = supervisor;
        this.registry = registry;
        this.keys = keys;
        this.ttl = ttl;
        this.encoder = encoder;
        this.metrics = metrics;
        this.openTelemetry = ot;
        this.tracer = ot.getTracer("event_publisher");
    }

    /**
     * Publishes one event.
     *
     * @param event the event
     * @return true if the event was stored and pushed to every matching
     *         subscriber
     */
    public boolean publish(DomainEvent event) {
        return processWithTelemetry(openTelemetry, tracer, event, "publish_event", () -> store(event));
    }

    private boolean store(DomainEvent event) {
        String type = event.type();

        if (!supervisor.isConnected()) {
            logger.atWarn().addArgument(type).log("Not connected, dropping {} event");
            metrics.recordDropped(type, "connect");
            return false;
        }

        String body;
        try {
            body = encoder.encode(event);
        } catch (JsonProcessingException e) {
            logger.atWarn().setCause(e).addArgument(type).log("Cannot encode {} event, dropping it");
            metrics.recordDropped(type, "encode");
            return false;
        }

        long index;
        try {
            index = supervisor.execute(StoreCommand.incr(keys.eventIndex()), StoreReply::asLong);
        } catch (StoreException e) {
            logger.atWarn()
                    .addArgument(keys.eventIndex())
                    .addArgument(e.getMessage())
                    .log("INCR {}: {}");
            metrics.recordDropped(type, "index");
            return false;
        }

        EventRecord record = new EventRecord(index, body, ttl);
        String key = keys.event(record.index());
        try {
            supervisor.execute(StoreCommand.set(key, record.body()));
            supervisor.execute(StoreCommand.expire(key, record.ttl().toSeconds()));
        } catch (StoreException e) {
            logger.atWarn()
                    .addArgument(key)
                    .addArgument(e.getMessage())
                    .log("Storing {} failed: {}");
            metrics.recordDropped(type, "persist");
            return false;
        }

        List<String> subscribers = registry.lookup(type);
        String value = Long.toString(record.index());
        for (String subscriberId : subscribers) {
            String list = keys.subscriberList(subscriberId);
            try {
                supervisor.execute(StoreCommand.lpush(list, value));
                metrics.recordPushed(type);
            } catch (StoreException e) {
                logger.atWarn()
                        .addArgument(list)
                        .addArgument(value)
                        .addArgument(e.getMessage())
                        .log("LPUSH {} {}: {}, remaining subscribers skipped");
                metrics.recordDropped(type, "fanout");
                return false;
            }
        }

        metrics.recordPublished(type);
        logger.atDebug()
                .addArgument(type)
                .addArgument(record.index())
                .addArgument(subscribers::size)
                .log("Published {} event {} to {} subscribers");
        return true;
    }
}
