package com.p14n.eventbridge.data;

public record ConfigData(String name,
        String storeHost,
        int storePort,
        String storePath,
        String storePassword,
        String keyPrefix,
        int reconnectIntervalSeconds,
        int subscriptionIntervalSeconds,
        int eventTtlSeconds) implements BridgeConfig {

    public ConfigData {
        if (reconnectIntervalSeconds <= 0 || subscriptionIntervalSeconds <= 0) {
            throw new IllegalArgumentException("Intervals must be positive");
        }
        if (eventTtlSeconds <= 0) {
            throw new IllegalArgumentException("Event ttl must be positive");
        }
    }

    public ConfigData(String storeHost,
                      int storePort,
                      String storePath,
                      String storePassword) {
        this("event-bridge", storeHost, storePort, storePath, storePassword, "icinga", 15, 15, 3600);
    }

    public ConfigData(String storeHost, int storePort) {
        this(storeHost, storePort, null, null);
    }
}
