package com.p14n.eventbridge.store;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Fake store recording every command it is sent. Supports the commands the
 * bridge uses and lets tests inject failures per command verb.
 */
public class InMemoryStore implements StoreConnection {

    private final List<StoreCommand> commands = new ArrayList<>();
    private final Map<String, Long> counters = new HashMap<>();
    private final Map<String, String> strings = new HashMap<>();
    private final Map<String, Long> ttls = new HashMap<>();
    private final Map<String, Deque<String>> lists = new HashMap<>();
    private final Map<String, Map<String, String>> hashes = new HashMap<>();
    private final Map<StoreCommand.Verb, StoreException.Kind> failures = new EnumMap<>(StoreCommand.Verb.class);
    private final Map<StoreCommand.Verb, Integer> failAtCall = new EnumMap<>(StoreCommand.Verb.class);
    private final Map<StoreCommand.Verb, StoreReply> replies = new EnumMap<>(StoreCommand.Verb.class);
    private boolean reachable = true;
    private boolean connected;
    private int connectCount;
    private int closeCount;

    public synchronized void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    /**
     * Every call with this verb fails with the given kind.
     */
    public synchronized InMemoryStore failOn(StoreCommand.Verb verb, StoreException.Kind kind) {
        failures.put(verb, kind);
        failAtCall.remove(verb);
        return this;
    }

    /**
     * Only the nth call (1 based, counted from now) with this verb fails.
     */
    public synchronized InMemoryStore failOnCall(StoreCommand.Verb verb, int nth, StoreException.Kind kind) {
        failures.put(verb, kind);
        failAtCall.put(verb, nth);
        return this;
    }

    /**
     * Calls with this verb succeed with the given reply instead of the real one.
     */
    public synchronized InMemoryStore replyWith(StoreCommand.Verb verb, StoreReply reply) {
        replies.put(verb, reply);
        return this;
    }

    public synchronized void clearFailures() {
        failures.clear();
        failAtCall.clear();
        replies.clear();
    }

    public synchronized InMemoryStore putSubscription(String subscriberId, String record) {
        hashes.computeIfAbsent("icinga:subscription", k -> new LinkedHashMap<>()).put(subscriberId, record);
        return this;
    }

    public synchronized InMemoryStore removeSubscription(String subscriberId) {
        hashes.getOrDefault("icinga:subscription", new LinkedHashMap<>()).remove(subscriberId);
        return this;
    }

    @Override
    public synchronized void connect() throws StoreException {
        if (connected) {
            return;
        }
        connectCount++;
        if (!reachable) {
            throw new StoreException(StoreException.Kind.UNREACHABLE, "Connection refused");
        }
        connected = true;
    }

    @Override
    public synchronized boolean isConnected() {
        return connected;
    }

    @Override
    public synchronized StoreReply execute(StoreCommand command) throws StoreException {
        if (!connected) {
            throw new StoreException(StoreException.Kind.DISCONNECTED, "Not connected, cannot send " + command);
        }
        commands.add(command);
        failIfRequested(command);

        StoreReply override = replies.get(command.verb());
        if (override != null) {
            return override;
        }

        List<String> args = command.args();
        switch (command.verb()) {
            case INCR: {
                long next = counters.merge(args.get(0), 1L, Long::sum);
                return StoreReply.integer(next);
            }
            case SET:
                strings.put(args.get(0), args.get(1));
                ttls.remove(args.get(0));
                return StoreReply.text("OK");
            case EXPIRE:
                if (!strings.containsKey(args.get(0))) {
                    return StoreReply.integer(0);
                }
                ttls.put(args.get(0), Long.parseLong(args.get(1)));
                return StoreReply.integer(1);
            case LPUSH: {
                Deque<String> list = lists.computeIfAbsent(args.get(0), k -> new ArrayDeque<>());
                list.addFirst(args.get(1));
                return StoreReply.integer(list.size());
            }
            case HGETALL: {
                List<StoreReply> elements = new ArrayList<>();
                for (Map.Entry<String, String> e : hashes.getOrDefault(args.get(0), Map.of()).entrySet()) {
                    elements.add(StoreReply.text(e.getKey()));
                    elements.add(StoreReply.text(e.getValue()));
                }
                return StoreReply.array(elements);
            }
            default:
                return StoreReply.text("OK");
        }
    }

    private void failIfRequested(StoreCommand command) throws StoreException {
        StoreException.Kind kind = failures.get(command.verb());
        if (kind == null) {
            return;
        }
        Integer nth = failAtCall.get(command.verb());
        if (nth != null) {
            if (nth > 1) {
                failAtCall.put(command.verb(), nth - 1);
                return;
            }
            failures.remove(command.verb());
            failAtCall.remove(command.verb());
        }
        if (kind == StoreException.Kind.DISCONNECTED) {
            connected = false;
        }
        throw new StoreException(kind, command + ": injected failure");
    }

    @Override
    public synchronized void close() {
        if (connected) {
            closeCount++;
        }
        connected = false;
    }

    public synchronized List<StoreCommand> commands() {
        return new ArrayList<>(commands);
    }

    public synchronized List<StoreCommand> commands(StoreCommand.Verb verb) {
        return commands.stream().filter(c -> c.verb() == verb).collect(Collectors.toList());
    }

    public synchronized List<StoreCommand.Verb> verbs() {
        return commands.stream().map(StoreCommand::verb).collect(Collectors.toList());
    }

    public synchronized void clearCommands() {
        commands.clear();
    }

    public synchronized String get(String key) {
        return strings.get(key);
    }

    public synchronized Long ttl(String key) {
        return ttls.get(key);
    }

    public synchronized List<String> list(String key) {
        return new ArrayList<>(lists.getOrDefault(key, new ArrayDeque<>()));
    }

    public synchronized int connectCount() {
        return connectCount;
    }

    public synchronized int closeCount() {
        return closeCount;
    }
}
