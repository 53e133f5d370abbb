package com.p14n.eventbridge.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A successful reply from the store. Error replies never become a
 * {@code StoreReply}; they are raised as {@link StoreException}.
 */
public record StoreReply(Type type, Long integer, String text, List<StoreReply> elements) {

    public enum Type {
        INTEGER,
        TEXT,
        ARRAY,
        NIL
    }

    private static final StoreReply NIL = new StoreReply(Type.NIL, null, null, List.of());

    public StoreReply {
        elements = elements == null ? List.of() : List.copyOf(elements);
    }

    public static StoreReply integer(long value) {
        return new StoreReply(Type.INTEGER, value, null, List.of());
    }

    public static StoreReply text(String value) {
        return new StoreReply(Type.TEXT, null, value, List.of());
    }

    public static StoreReply array(List<StoreReply> elements) {
        return new StoreReply(Type.ARRAY, null, null, elements);
    }

    public static StoreReply nil() {
        return NIL;
    }

    /**
     * Reads the reply as an integer.
     *
     * @return the integer value
     * @throws StoreException with kind PROTOCOL_ERROR if the reply is not an
     *                        integer
     */
    public long asLong() throws StoreException {
        if (type != Type.INTEGER) {
            throw new StoreException(StoreException.Kind.PROTOCOL_ERROR, "Expected integer reply but got " + type);
        }
        return integer;
    }

    /**
     * Reads a flat array of alternating keys and values as a map, preserving
     * the order of the reply.
     *
     * @return map of field to value
     * @throws StoreException with kind PROTOCOL_ERROR if the reply is not an
     *                        array of text elements with an even length
     */
    public Map<String, String> asPairs() throws StoreException {
        if (type == Type.NIL) {
            return Map.of();
        }
        if (type != Type.ARRAY) {
            throw new StoreException(StoreException.Kind.PROTOCOL_ERROR, "Expected array reply but got " + type);
        }
        if (elements.size() % 2 != 0) {
            throw new StoreException(StoreException.Kind.PROTOCOL_ERROR,
                    "Expected key/value pairs but got " + elements.size() + " elements");
        }
        Map<String, String> pairs = new LinkedHashMap<>();
        for (int i = 0; i < elements.size(); i += 2) {
            StoreReply key = elements.get(i);
            StoreReply value = elements.get(i + 1);
            if (key.type != Type.TEXT) {
                throw new StoreException(StoreException.Kind.PROTOCOL_ERROR, "Expected text key but got " + key.type);
            }
            pairs.put(key.text, value.type == Type.TEXT ? value.text : null);
        }
        return pairs;
    }
}
