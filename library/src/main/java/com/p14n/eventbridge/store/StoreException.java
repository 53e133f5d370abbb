package com.p14n.eventbridge.store;

/**
 * Failure reported by the store layer. Every failure carries one of a closed
 * set of {@link Kind}s so callers can switch on it instead of inspecting
 * replies.
 */
public class StoreException extends Exception {

    /**
     * The kinds of failure the store layer reports.
     */
    public enum Kind {
        /** The transport could not be established. */
        UNREACHABLE,
        /** The store rejected the configured password. */
        AUTH_FAILED,
        /** The store answered with an error or with a reply of the wrong shape. */
        PROTOCOL_ERROR,
        /** No connection is established, or it broke while in use. */
        DISCONNECTED,
        /** A stored record could not be decoded. */
        DECODE_ERROR
    }

    private final Kind kind;

    public StoreException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public StoreException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public String toString() {
        return kind + ": " + getMessage();
    }
}
