package com.p14n.eventbridge.store;

import java.util.Locale;

import com.p14n.eventbridge.telemetry.BridgeMetrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the store connection alive.
 *
 * <p>
 * The connection is either connected or disconnected. A {@link #tick()} while
 * disconnected attempts to connect; a failed command sent through
 * {@link #execute(StoreCommand)} tears the connection down so the next tick
 * reconnects. Failures are logged and never escape, so the supervisor keeps
 * retrying for as long as ticks arrive.
 * </p>
 *
 * <p>
 * Like the connection it guards, this class is only used from the
 * {@link com.p14n.eventbridge.broker.CommandSequencer} worker.
 * </p>
 */
public class ConnectionSupervisor {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private final StoreConnection connection;
    private final BridgeMetrics metrics;

    public ConnectionSupervisor(StoreConnection connection, BridgeMetrics metrics) {
        this.connection = connection;
        this.metrics = metrics;
    }

    /**
     * Connects if not already connected.
     *
     * @return true if the connection is established after the tick
     */
    public boolean tick() {
        if (connection.isConnected()) {
            return true;
        }

        logger.atInfo().log("Trying to connect to store");
        try {
            connection.connect();
            metrics.recordConnectAttempt("connected");
            logger.atInfo().log("Connected to store");
            return true;
        } catch (StoreException e) {
            metrics.recordConnectAttempt(e.kind().name().toLowerCase(Locale.ROOT));
            logger.atWarn()
                    .addArgument(e.kind())
                    .addArgument(e.getMessage())
                    .log("Connection error ({}): {}");
            return false;
        }
    }

    public boolean isConnected() {
        return connection.isConnected();
    }

    /**
     * Sends a command. Any failure tears the connection down before the
     * exception is passed on; the caller abandons its remaining steps.
     *
     * @param command the command to send
     * @return the reply
     * @throws StoreException if the command failed or no connection exists
     */
    public StoreReply execute(StoreCommand command) throws StoreException {
        try {
            return connection.execute(command);
        } catch (StoreException e) {
            disconnect(e);
            throw e;
        }
    }

    /**
     * Sends a command and reads its reply. A reply of the wrong shape is
     * treated like a failed command.
     *
     * @param command the command to send
     * @param reader  converts the reply
     * @return the converted reply
     * @throws StoreException if the command failed or the reply could not be
     *                        read
     */
    public <T> T execute(StoreCommand command, ReplyReader<T> reader) throws StoreException {
        StoreReply reply = execute(command);
        try {
            return reader.read(reply);
        } catch (StoreException e) {
            disconnect(e);
            throw e;
        }
    }

    /**
     * Converts a reply into the value a caller expects.
     */
    @FunctionalInterface
    public interface ReplyReader<T> {
        T read(StoreReply reply) throws StoreException;
    }

    private void disconnect(StoreException cause) {
        if (connection.isConnected()) {
            logger.atWarn().addArgument(cause.getMessage()).log("Dropping store connection after failure: {}");
        }
        connection.close();
    }

    /**
     * Releases the connection on shutdown.
     */
    public void close() {
        connection.close();
    }
}
