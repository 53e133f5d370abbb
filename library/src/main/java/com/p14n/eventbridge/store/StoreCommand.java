package com.p14n.eventbridge.store;

import java.util.List;

/**
 * A single request sent to the store.
 *
 * <p>
 * Instances are built with the static factories, one per command the bridge
 * issues:
 * </p>
 *
 * <pre>{@code
 * StoreCommand.incr("icinga:event.idx");
 * StoreCommand.set("icinga:event.42", body);
 * StoreCommand.expire("icinga:event.42", 3600);
 * }</pre>
 */
public record StoreCommand(Verb verb, List<String> args) {

    /**
     * Commands understood by the bridge.
     */
    public enum Verb {
        AUTH,
        INCR,
        SET,
        EXPIRE,
        LPUSH,
        HGETALL
    }

    public StoreCommand {
        if (verb == null) {
            throw new IllegalArgumentException("verb cannot be null");
        }
        args = List.copyOf(args);
    }

    public static StoreCommand auth(String password) {
        return new StoreCommand(Verb.AUTH, List.of(password));
    }

    public static StoreCommand incr(String key) {
        return new StoreCommand(Verb.INCR, List.of(key));
    }

    public static StoreCommand set(String key, String value) {
        return new StoreCommand(Verb.SET, List.of(key, value));
    }

    public static StoreCommand expire(String key, long seconds) {
        return new StoreCommand(Verb.EXPIRE, List.of(key, Long.toString(seconds)));
    }

    public static StoreCommand lpush(String key, String value) {
        return new StoreCommand(Verb.LPUSH, List.of(key, value));
    }

    public static StoreCommand hgetall(String key) {
        return new StoreCommand(Verb.HGETALL, List.of(key));
    }

    /**
     * Returns the key the command addresses, or an empty string for AUTH.
     *
     * @return the key
     */
    public String key() {
        return verb == Verb.AUTH || args.isEmpty() ? "" : args.get(0);
    }

    public String[] argArray() {
        return args.toArray(new String[0]);
    }

    /**
     * Renders the command for log output. Values are left out so passwords
     * and event bodies never reach the log.
     */
    @Override
    public String toString() {
        return verb == Verb.AUTH ? "AUTH ****" : verb + " " + key();
    }
}
