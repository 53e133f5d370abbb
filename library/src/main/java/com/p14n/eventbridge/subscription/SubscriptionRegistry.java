package com.p14n.eventbridge.subscription;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableMap;
import com.p14n.eventbridge.data.EventType;
import com.p14n.eventbridge.data.SubscriptionInfo;
import com.p14n.eventbridge.store.ConnectionSupervisor;
import com.p14n.eventbridge.store.StoreCommand;
import com.p14n.eventbridge.store.StoreException;
import com.p14n.eventbridge.store.StoreKeys;
import com.p14n.eventbridge.store.StoreReply;
import com.p14n.eventbridge.telemetry.BridgeMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the subscriber filters read from the store.
 *
 * <p>
 * Each field of the subscription hash is a subscriber id; its value is a JSON
 * record such as {@code {"types":["StateChange","Notification"]}}. A refresh
 * reads the whole hash and installs a new table in one step, so
 * {@link #lookup(String)} always sees either the old or the new table. Records
 * that cannot be decoded are logged and left out; the rest are still
 * installed.
 * </p>
 *
 * <p>
 * {@link #refresh()} must run on the
 * {@link com.p14n.eventbridge.broker.CommandSequencer} worker.
 * </p>
 */
public class SubscriptionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SubscriptionRegistry.class);
    private static final ObjectMapper mapper = new ObjectMapper();

    private final ConnectionSupervisor supervisor;
    private final StoreKeys keys;
    private final BridgeMetrics metrics;
    private volatile Map<String, SubscriptionInfo> table = ImmutableMap.of();

    public SubscriptionRegistry(ConnectionSupervisor supervisor, StoreKeys keys, BridgeMetrics metrics) {
        this.supervisor = supervisor;
        this.keys = keys;
        this.metrics = metrics;
    }

    /**
     * Reads all subscriber records and replaces the table. Does nothing while
     * disconnected. If the read fails the connection is dropped and the
     * current table is kept.
     *
     * @return true if a new table was installed
     */
    public boolean refresh() {
        if (!supervisor.isConnected()) {
            logger.atDebug().log("Not connected, skipping subscription refresh");
            return false;
        }

        Map<String, String> records;
        try {
            records = supervisor.execute(StoreCommand.hgetall(keys.subscriptions()), StoreReply::asPairs);
        } catch (StoreException e) {
            logger.atWarn()
                    .addArgument(keys.subscriptions())
                    .addArgument(e.getMessage())
                    .log("HGETALL {}: {}");
            return false;
        }

        ImmutableMap.Builder<String, SubscriptionInfo> next = ImmutableMap.builder();
        int rejected = 0;
        for (Map.Entry<String, String> record : records.entrySet()) {
            try {
                next.put(record.getKey(), decode(record.getKey(), record.getValue()));
            } catch (StoreException e) {
                rejected++;
                metrics.recordDecodeFailure();
                logger.atWarn()
                        .addArgument(record.getKey())
                        .addArgument(e.getMessage())
                        .log("Ignoring subscription of '{}': {}");
            }
        }

        Map<String, SubscriptionInfo> installed = next.build();
        table = installed;
        metrics.recordSubscriptionsInstalled(installed.size());

        int rejectedCount = rejected;
        logger.atDebug()
                .addArgument(installed::size)
                .addArgument(() -> rejectedCount)
                .log("Installed {} subscriptions, {} rejected");
        return true;
    }

    /**
     * Returns every subscriber whose filter contains the event type, in the
     * order the store listed them. Never touches the store.
     *
     * @param eventType the event type name
     * @return subscriber ids
     */
    public List<String> lookup(String eventType) {
        return table.values().stream()
                .filter(info -> info.accepts(eventType))
                .map(SubscriptionInfo::subscriberId)
                .collect(Collectors.toList());
    }

    /**
     * @return the currently installed table
     */
    public Map<String, SubscriptionInfo> snapshot() {
        return table;
    }

    static SubscriptionInfo decode(String subscriberId, String value) throws StoreException {
        if (subscriberId == null || subscriberId.isEmpty()) {
            throw new StoreException(StoreException.Kind.DECODE_ERROR, "Empty subscriber id");
        }
        if (value == null) {
            throw new StoreException(StoreException.Kind.DECODE_ERROR, "Missing filter record");
        }

        JsonNode node;
        try {
            node = mapper.readTree(value);
        } catch (JsonProcessingException e) {
            throw new StoreException(StoreException.Kind.DECODE_ERROR, "Invalid JSON: " + e.getOriginalMessage(), e);
        }

        JsonNode types = node == null ? null : node.get("types");
        if (types == null || !types.isArray()) {
            throw new StoreException(StoreException.Kind.DECODE_ERROR, "Field 'types' is missing or not a list");
        }

        Set<String> eventTypes = new LinkedHashSet<>();
        for (JsonNode type : types) {
            if (!type.isTextual()) {
                throw new StoreException(StoreException.Kind.DECODE_ERROR, "Field 'types' must only contain strings");
            }
            String name = type.asText();
            if (EventType.fromName(name).isPresent()) {
                eventTypes.add(name);
            } else {
                logger.atDebug()
                        .addArgument(subscriberId)
                        .addArgument(name)
                        .log("Subscriber '{}' asked for unknown event type '{}'");
            }
        }
        return new SubscriptionInfo(subscriberId, eventTypes);
    }
}
