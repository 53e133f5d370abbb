package com.p14n.eventbridge.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for the event bridge.
 *
 * <p>
 * Instruments:
 * </p>
 * <ul>
 * <li>events_received: events taken from the monitoring event bus, per
 * type</li>
 * <li>events_published: events stored and fanned out, per type</li>
 * <li>events_dropped: events abandoned, per type and failing step</li>
 * <li>fanout_pushes: indexes pushed onto subscriber lists, per type</li>
 * <li>subscription_decode_failures: subscriber records that could not be
 * decoded</li>
 * <li>connect_attempts: connection attempts, per outcome</li>
 * <li>active_subscriptions: subscribers in the installed table</li>
 * </ul>
 */
public class BridgeMetrics {
        private static final AttributeKey<String> TYPE = AttributeKey.stringKey("type");
        private static final AttributeKey<String> STEP = AttributeKey.stringKey("step");
        private static final AttributeKey<String> OUTCOME = AttributeKey.stringKey("outcome");

        private final LongCounter receivedEvents;
        private final LongCounter publishedEvents;
        private final LongCounter droppedEvents;
        private final LongCounter fanoutPushes;
        private final LongCounter decodeFailures;
        private final LongCounter connectAttempts;
        private final LongUpDownCounter activeSubscriptions;
        private long installedSubscriptions;

        /**
         * Creates a new BridgeMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BridgeMetrics(Meter meter) {
                receivedEvents = meter.counterBuilder("events_received")
                                .setDescription("Number of events taken from the event bus")
                                .build();

                publishedEvents = meter.counterBuilder("events_published")
                                .setDescription("Number of events stored and delivered to subscribers")
                                .build();

                droppedEvents = meter.counterBuilder("events_dropped")
                                .setDescription("Number of events abandoned after a store failure")
                                .build();

                fanoutPushes = meter.counterBuilder("fanout_pushes")
                                .setDescription("Number of event indexes pushed to subscriber lists")
                                .build();

                decodeFailures = meter.counterBuilder("subscription_decode_failures")
                                .setDescription("Number of subscriber records that could not be decoded")
                                .build();

                connectAttempts = meter.counterBuilder("connect_attempts")
                                .setDescription("Number of attempts to connect to the store")
                                .build();

                activeSubscriptions = meter.upDownCounterBuilder("active_subscriptions")
                                .setDescription("Number of subscribers in the installed subscription table")
                                .build();
        }

        public void recordReceived(String type) {
                receivedEvents.add(1, Attributes.of(TYPE, type));
        }

        public void recordPublished(String type) {
                publishedEvents.add(1, Attributes.of(TYPE, type));
        }

        /**
         * Records an abandoned event.
         *
         * @param type the event type
         * @param step the pipeline step that failed
         */
        public void recordDropped(String type, String step) {
                droppedEvents.add(1, Attributes.of(TYPE, type, STEP, step));
        }

        public void recordPushed(String type) {
                fanoutPushes.add(1, Attributes.of(TYPE, type));
        }

        public void recordDecodeFailure() {
                decodeFailures.add(1);
        }

        public void recordConnectAttempt(String outcome) {
                connectAttempts.add(1, Attributes.of(OUTCOME, outcome));
        }

        /**
         * Records the size of a newly installed subscription table.
         * Only called from the command sequencer worker.
         *
         * @param count number of subscribers in the table
         */
        public void recordSubscriptionsInstalled(int count) {
                activeSubscriptions.add(count - installedSubscriptions);
                installedSubscriptions = count;
        }
}
