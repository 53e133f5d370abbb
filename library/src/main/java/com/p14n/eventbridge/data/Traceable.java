package com.p14n.eventbridge.data;

/**
 * Interface for objects that can be traced and identified in a distributed
 * system.
 * Provides essential methods for tracking and correlating events across
 * services.
 *
 * <p>
 * Key attributes:
 * </p>
 * <ul>
 * <li>{@code topic}: Message routing or categorization identifier</li>
 * <li>{@code subject}: Monitored object the message is about</li>
 * <li>{@code traceparent}: OpenTelemetry trace context identifier</li>
 * </ul>
 */
public interface Traceable {

    /**
     * Returns the topic used for message routing.
     *
     * @return the topic string
     */
    String topic();

    /**
     * Returns the monitored object identifier.
     *
     * @return the subject string
     */
    String subject();

    /**
     * Returns the OpenTelemetry trace parent identifier for distributed tracing.
     *
     * @return the trace parent string, or null when the message carries none
     */
    String traceparent();
}
