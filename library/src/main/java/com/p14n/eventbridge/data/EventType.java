package com.p14n.eventbridge.data;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The kinds of monitoring events forwarded to the store.
 * Constant names match the type names used on the event bus and in
 * subscriber filters.
 */
public enum EventType {

    CheckResult,
    StateChange,
    Notification,
    AcknowledgementSet,
    AcknowledgementCleared,
    CommentAdded,
    CommentRemoved,
    DowntimeAdded,
    DowntimeRemoved,
    DowntimeStarted,
    DowntimeTriggered;

    private static final Set<String> NAMES = Arrays.stream(values())
            .map(Enum::name)
            .collect(Collectors.toUnmodifiableSet());

    /**
     * Returns the names of every recognized event type.
     *
     * @return unmodifiable set of type names
     */
    public static Set<String> names() {
        return NAMES;
    }

    /**
     * Looks up an event type by its exact name.
     *
     * @param name the type name, case sensitive
     * @return the matching type, or empty if the name is not recognized
     */
    public static Optional<EventType> fromName(String name) {
        if (name == null || !NAMES.contains(name)) {
            return Optional.empty();
        }
        return Optional.of(valueOf(name));
    }
}
