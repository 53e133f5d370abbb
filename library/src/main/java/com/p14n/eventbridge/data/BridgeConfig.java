package com.p14n.eventbridge.data;

/**
 * Configuration interface for the event bridge.
 * Defines where the store lives, how to authenticate and how often the
 * periodic work runs.
 */
public interface BridgeConfig {

    /**
     * Gets the instance name used in lifecycle log messages.
     *
     * @return The instance name
     */
    default String name() {
        return "event-bridge";
    }

    /**
     * Gets the store host address. Ignored when {@link #storePath()} is set.
     *
     * @return The store host address
     */
    String storeHost();

    /**
     * Gets the store port number. Ignored when {@link #storePath()} is set.
     *
     * @return The store port number
     */
    int storePort();

    /**
     * Gets the path of the store's local socket.
     *
     * @return The socket path, or null to connect over the network
     */
    String storePath();

    /**
     * Gets the store password.
     *
     * @return The password, or null if the store needs no authentication
     */
    String storePassword();

    /**
     * Gets the prefix of every key the bridge writes or reads.
     *
     * @return The key prefix
     */
    default String keyPrefix() {
        return "icinga";
    }

    /**
     * Gets the interval between reconnect attempts.
     * Default is 15 seconds.
     *
     * @return The reconnect interval in seconds
     */
    default int reconnectIntervalSeconds() {
        return 15;
    }

    /**
     * Gets the interval between subscription refreshes.
     * Default is 15 seconds.
     *
     * @return The refresh interval in seconds
     */
    default int subscriptionIntervalSeconds() {
        return 15;
    }

    /**
     * Gets how long a stored event body is kept.
     * Default is one hour.
     *
     * @return The event time-to-live in seconds
     */
    default int eventTtlSeconds() {
        return 3600;
    }

    /**
     * Gets the timeout for establishing the store connection.
     *
     * @return The connect timeout in milliseconds
     */
    default int connectTimeoutMillis() {
        return 2000;
    }

    /**
     * Gets the timeout for a single reply from the store.
     *
     * @return The socket timeout in milliseconds
     */
    default int socketTimeoutMillis() {
        return 2000;
    }

    /**
     * Gets how long shutdown waits for the command in progress to finish.
     *
     * @return The shutdown timeout in milliseconds
     */
    default long shutdownTimeoutMillis() {
        return 5000;
    }
}
