package com.p14n.eventbridge.store;

import java.io.File;

import redis.clients.jedis.ClientSetInfoConfig;
import redis.clients.jedis.DefaultJedisClientConfig;
import redis.clients.jedis.HostAndPort;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisClientConfig;
import redis.clients.jedis.exceptions.JedisException;

/**
 * Opens a Jedis client for a {@link StoreTarget}.
 */
@FunctionalInterface
public interface JedisFactory {

    Jedis open(StoreTarget target) throws JedisException;

    /**
     * Creates the default factory. The client is configured without a password
     * and without client info so it sends no commands of its own; AUTH is
     * issued by {@link JedisStoreConnection}.
     *
     * @param connectTimeoutMillis timeout for establishing the transport
     * @param socketTimeoutMillis  timeout for each reply
     * @return a factory for network and local socket targets
     */
    static JedisFactory create(int connectTimeoutMillis, int socketTimeoutMillis) {
        JedisClientConfig config = DefaultJedisClientConfig.builder()
                .connectionTimeoutMillis(connectTimeoutMillis)
                .socketTimeoutMillis(socketTimeoutMillis)
                .clientSetInfoConfig(ClientSetInfoConfig.DISABLED)
                .build();
        return target -> {
            if (target.isLocalSocket()) {
                return new Jedis(new UnixSocketFactory(new File(target.path()),
                        connectTimeoutMillis, socketTimeoutMillis), config);
            }
            return new Jedis(new HostAndPort(target.host(), target.port()), config);
        };
    }
}
