package com.p14n.eventbridge.store;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import redis.clients.jedis.Jedis;
import redis.clients.jedis.Protocol;
import redis.clients.jedis.exceptions.JedisConnectionException;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.exceptions.JedisException;

/**
 * {@link StoreConnection} backed by a single Jedis client.
 *
 * <p>
 * The client only exists while connected. A failed connect or AUTH closes it
 * before the error is raised, and a transport failure during
 * {@link #execute(StoreCommand)} discards it, so the next
 * {@link #connect()} always starts from a fresh transport.
 * </p>
 */
public class JedisStoreConnection implements StoreConnection {

    private static final Logger logger = LoggerFactory.getLogger(JedisStoreConnection.class);

    private final StoreTarget target;
    private final String password;
    private final JedisFactory jedisFactory;
    private volatile Jedis jedis;

    public JedisStoreConnection(StoreTarget target, String password, JedisFactory jedisFactory) {
        if (target == null) {
            throw new IllegalArgumentException("Target cannot be null");
        }
        this.target = target;
        this.password = password;
        this.jedisFactory = jedisFactory;
    }

    public JedisStoreConnection(StoreTarget target, String password, int connectTimeoutMillis,
            int socketTimeoutMillis) {
        this(target, password, JedisFactory.create(connectTimeoutMillis, socketTimeoutMillis));
    }

    @Override
    public void connect() throws StoreException {
        if (jedis != null) {
            return;
        }

        Jedis candidate = null;
        try {
            candidate = jedisFactory.open(target);
            if (!candidate.isConnected()) {
                candidate.connect();
            }
        } catch (JedisException e) {
            release(candidate);
            throw new StoreException(StoreException.Kind.UNREACHABLE,
                    "Cannot connect to " + target + ": " + e.getMessage(), e);
        }

        if (password != null && !password.isEmpty()) {
            try {
                Object reply = send(candidate, StoreCommand.auth(password));
                logger.atInfo().addArgument(() -> text(reply)).log("AUTH: {}");
            } catch (JedisDataException e) {
                release(candidate);
                throw new StoreException(StoreException.Kind.AUTH_FAILED, "AUTH: " + e.getMessage(), e);
            } catch (JedisException e) {
                release(candidate);
                throw new StoreException(StoreException.Kind.UNREACHABLE,
                        "Connection to " + target + " lost during AUTH: " + e.getMessage(), e);
            }
        }

        jedis = candidate;
        logger.atDebug().addArgument(target).log("Connected to {}");
    }

    @Override
    public boolean isConnected() {
        return jedis != null;
    }

    @Override
    public StoreReply execute(StoreCommand command) throws StoreException {
        Jedis client = jedis;
        if (client == null) {
            throw new StoreException(StoreException.Kind.DISCONNECTED, "Not connected, cannot send " + command);
        }

        Object raw;
        try {
            raw = send(client, command);
        } catch (JedisConnectionException e) {
            close();
            throw new StoreException(StoreException.Kind.DISCONNECTED, command + ": " + e.getMessage(), e);
        } catch (JedisDataException e) {
            throw new StoreException(StoreException.Kind.PROTOCOL_ERROR, command + ": " + e.getMessage(), e);
        } catch (JedisException e) {
            close();
            throw new StoreException(StoreException.Kind.PROTOCOL_ERROR, command + ": " + e.getMessage(), e);
        }
        return toReply(raw);
    }

    @Override
    public void close() {
        Jedis current = jedis;
        jedis = null;
        release(current);
    }

    private static Object send(Jedis client, StoreCommand command) {
        return client.sendCommand(Protocol.Command.valueOf(command.verb().name()), command.argArray());
    }

    static StoreReply toReply(Object raw) throws StoreException {
        if (raw == null) {
            return StoreReply.nil();
        }
        if (raw instanceof Long) {
            return StoreReply.integer((Long) raw);
        }
        if (raw instanceof byte[]) {
            return StoreReply.text(new String((byte[]) raw, StandardCharsets.UTF_8));
        }
        if (raw instanceof String) {
            return StoreReply.text((String) raw);
        }
        if (raw instanceof List) {
            List<StoreReply> elements = new ArrayList<>();
            for (Object element : (List<?>) raw) {
                elements.add(toReply(element));
            }
            return StoreReply.array(elements);
        }
        throw new StoreException(StoreException.Kind.PROTOCOL_ERROR,
                "Unexpected reply type " + raw.getClass().getName());
    }

    private static String text(Object reply) {
        return reply instanceof byte[] ? new String((byte[]) reply, StandardCharsets.UTF_8) : String.valueOf(reply);
    }

    private void release(Jedis client) {
        if (client == null) {
            return;
        }
        try {
            client.close();
        } catch (JedisException e) {
            logger.atDebug().setCause(e).addArgument(target).log("Error closing connection to {}");
        }
    }
}
