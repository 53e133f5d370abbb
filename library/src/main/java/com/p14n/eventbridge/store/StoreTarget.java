package com.p14n.eventbridge.store;

import com.p14n.eventbridge.data.BridgeConfig;

/**
 * Where the store lives: either a host and port or the path of a local
 * socket. A non-blank path takes precedence.
 */
public record StoreTarget(String host, int port, String path) {

    public static StoreTarget from(BridgeConfig config) {
        return new StoreTarget(config.storeHost(), config.storePort(), config.storePath());
    }

    public static StoreTarget network(String host, int port) {
        return new StoreTarget(host, port, null);
    }

    public static StoreTarget localSocket(String path) {
        return new StoreTarget(null, 0, path);
    }

    public boolean isLocalSocket() {
        return path != null && !path.isBlank();
    }

    @Override
    public String toString() {
        return isLocalSocket() ? "unix:" + path : host + ":" + port;
    }
}
