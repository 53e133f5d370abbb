package com.p14n.eventbridge;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import com.p14n.eventbridge.broker.AsyncExecutor;
import com.p14n.eventbridge.broker.CommandSequencer;
import com.p14n.eventbridge.broker.DefaultExecutor;
import com.p14n.eventbridge.broker.EventBus;
import com.p14n.eventbridge.data.BridgeConfig;
import com.p14n.eventbridge.publish.EventEncoder;
import com.p14n.eventbridge.publish.EventPublisher;
import com.p14n.eventbridge.store.ConnectionSupervisor;
import com.p14n.eventbridge.store.JedisStoreConnection;
import com.p14n.eventbridge.store.StoreConnection;
import com.p14n.eventbridge.store.StoreKeys;
import com.p14n.eventbridge.store.StoreTarget;
import com.p14n.eventbridge.subscription.SubscriptionRegistry;
import com.p14n.eventbridge.telemetry.BridgeMetrics;

import io.opentelemetry.api.OpenTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards monitoring events from an {@link EventBus} into the store.
 *
 * <p>
 * Wires the pieces together and owns their lifecycle:
 * </p>
 * <ul>
 * <li>a {@link CommandSequencer} that runs every store operation, one at a
 * time</li>
 * <li>a reconnect tick and a subscription refresh tick, both enqueued on the
 * sequencer. Each runs once on start, reconnect first, then once per
 * interval</li>
 * <li>an {@link EventSourceAdapter} that turns bus events into publish
 * tasks</li>
 * </ul>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * var bus = new EventBus();
 * try (var bridge = new EventBridge(config, bus, OpenTelemetry.noop())) {
 *     bridge.start();
 *     bus.publish(DomainEvent.create(EventType.StateChange, Map.of("host", "web01")));
 * }
 * }</pre>
 */
public class EventBridge implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventBridge.class);

    private final BridgeConfig cfg;
    private final EventBus bus;
    private final StoreConnection connection;
    private final AsyncExecutor asyncExecutor;
    private final OpenTelemetry ot;
    private CommandSequencer sequencer;
    private ConnectionSupervisor supervisor;
    private SubscriptionRegistry registry;
    private EventSourceAdapter adapter;
    private ScheduledFuture<?> reconnectTicker;
    private ScheduledFuture<?> refreshTicker;
    private boolean closed;

    /**
     * Creates a bridge with a custom connection and executor.
     *
     * @param cfg           The bridge configuration
     * @param bus           The event bus to drain
     * @param connection    The store connection, used only from the sequencer
     * @param asyncExecutor Runs the ticks and the event loop
     * @param ot            OpenTelemetry instance for monitoring
     */
    public EventBridge(BridgeConfig cfg, EventBus bus, StoreConnection connection, AsyncExecutor asyncExecutor,
            OpenTelemetry ot) {
        this.cfg = cfg;
        this.bus = bus;
        this.connection = connection;
        this.asyncExecutor = asyncExecutor;
        this.ot = ot;
    }

    /**
     * Creates a bridge connecting to the store named in the configuration.
     *
     * @param cfg The bridge configuration
     * @param bus The event bus to drain
     * @param ot  OpenTelemetry instance for monitoring
     */
    public EventBridge(BridgeConfig cfg, EventBus bus, OpenTelemetry ot) {
        this(cfg, bus,
                new JedisStoreConnection(StoreTarget.from(cfg), cfg.storePassword(),
                        cfg.connectTimeoutMillis(), cfg.socketTimeoutMillis()),
                new DefaultExecutor(cfg.name(), 2), ot);
    }

    /**
     * Starts the sequencer, the ticks and the event loop.
     *
     * @throws IllegalStateException If the bridge is already started
     */
    public synchronized void start() {
        if (sequencer != null) {
            logger.atError().addArgument(cfg::name).log("'{}' already started");
            throw new IllegalStateException("Already started");
        }

        var metrics = new BridgeMetrics(ot.getMeter("event_bridge"));
        var keys = new StoreKeys(cfg.keyPrefix());
        sequencer = new CommandSequencer(cfg.name(), cfg.shutdownTimeoutMillis());
        supervisor = new ConnectionSupervisor(connection, metrics);
        registry = new SubscriptionRegistry(supervisor, keys, metrics);
        var publisher = new EventPublisher(supervisor, registry, keys,
                Duration.ofSeconds(cfg.eventTtlSeconds()), new EventEncoder(), metrics, ot);
        adapter = new EventSourceAdapter(bus, sequencer, publisher, metrics);

        sequencer.start();
        sequencer.enqueue(supervisor::tick);
        sequencer.enqueue(registry::refresh);
        reconnectTicker = asyncExecutor.scheduleAtFixedRate(() -> submit(supervisor::tick),
                cfg.reconnectIntervalSeconds(), cfg.reconnectIntervalSeconds(), TimeUnit.SECONDS);
        refreshTicker = asyncExecutor.scheduleAtFixedRate(() -> submit(registry::refresh),
                cfg.subscriptionIntervalSeconds(), cfg.subscriptionIntervalSeconds(), TimeUnit.SECONDS);
        adapter.start(asyncExecutor);

        logger.atInfo().addArgument(cfg::name).log("'{}' started.");
    }

    private void submit(Runnable task) {
        try {
            sequencer.enqueue(task);
        } catch (IllegalStateException e) {
            logger.atDebug().log("Command sequencer closed, skipping tick");
        }
    }

    /**
     * @return the registry holding the current subscriber filters
     */
    public SubscriptionRegistry subscriptions() {
        return registry;
    }

    /**
     * @return the sequencer running every store operation
     */
    public CommandSequencer sequencer() {
        return sequencer;
    }

    /**
     * Stops the event loop and the ticks, lets queued work finish and closes
     * the connection from the sequencer worker after the last queued task.
     * Errors while closing one part are logged and the remaining parts are
     * still closed.
     */
    @Override
    public synchronized void close() {
        if (sequencer == null || closed) {
            return;
        }
        closed = true;

        Map<String, AutoCloseable> closeables = new LinkedHashMap<>();
        closeables.put("event loop", adapter);
        closeables.put("reconnect ticker", () -> reconnectTicker.cancel(false));
        closeables.put("subscription ticker", () -> refreshTicker.cancel(false));
        closeables.put("command sequencer", this::stopSequencer);
        closeables.put("executor", asyncExecutor);

        for (Map.Entry<String, AutoCloseable> c : closeables.entrySet()) {
            try {
                c.getValue().close();
            } catch (Exception e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(c.getKey())
                        .log("Error closing {}");
            }
        }

        logger.atInfo().addArgument(cfg::name).log("'{}' stopped.");
    }

    private void stopSequencer() {
        if (!sequencer.close(supervisor::close)) {
            logger.atWarn()
                    .addArgument(cfg::name)
                    .log("'{}' store connection still in use by a stuck command, leaving it open");
        }
    }
}
