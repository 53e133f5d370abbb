package com.p14n.eventbridge.store;

/**
 * A single logical connection to the store.
 *
 * <p>
 * Implementations are not thread safe. All calls are expected to come from
 * the {@link com.p14n.eventbridge.broker.CommandSequencer} worker.
 * </p>
 */
public interface StoreConnection extends AutoCloseable {

    /**
     * Establishes the connection and authenticates if a password is
     * configured. Does nothing if already connected. On failure no partially
     * opened transport is kept.
     *
     * @throws StoreException with kind UNREACHABLE or AUTH_FAILED
     */
    void connect() throws StoreException;

    /**
     * @return true while a connection is established
     */
    boolean isConnected();

    /**
     * Sends one command and waits for its reply. A broken transport moves the
     * connection to the disconnected state before the exception is raised.
     * Nothing is retried.
     *
     * @param command the command to send
     * @return the reply
     * @throws StoreException with kind PROTOCOL_ERROR or DISCONNECTED
     */
    StoreReply execute(StoreCommand command) throws StoreException;

    /**
     * Releases the transport if connected.
     */
    @Override
    void close();
}
