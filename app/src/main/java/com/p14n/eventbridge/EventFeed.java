package com.p14n.eventbridge;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.eventbridge.broker.EventBus;
import com.p14n.eventbridge.data.DomainEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads monitoring events as JSON lines and publishes them on the event bus.
 *
 * <p>
 * Each line is one object with a {@code type} field, an optional
 * {@code traceparent} field and any number of attributes:
 * </p>
 *
 * <pre>{@code
 * {"type":"StateChange","host":"web01","service":"http","state":2}
 * }</pre>
 */
public class EventFeed {

    private static final Logger logger = LoggerFactory.getLogger(EventFeed.class);
    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT = new TypeReference<>() {
    };

    private final EventBus bus;
    private final ObjectMapper mapper = new ObjectMapper();

    public EventFeed(EventBus bus) {
        this.bus = bus;
    }

    /**
     * Publishes every well formed line until the reader is exhausted.
     * Malformed lines are logged and skipped.
     *
     * @param input the source of JSON lines
     * @return number of events published
     * @throws IOException if reading fails
     */
    public int pump(Reader input) throws IOException {
        int published = 0;
        BufferedReader reader = new BufferedReader(input);
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            DomainEvent event;
            try {
                event = parse(line);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                logger.atWarn().addArgument(e.getMessage()).log("Skipping malformed event: {}");
                continue;
            }
            bus.publish(event);
            published++;
        }
        return published;
    }

    DomainEvent parse(String line) throws JsonProcessingException {
        Map<String, Object> fields = mapper.readValue(line, OBJECT);
        if (fields == null) {
            throw new IllegalArgumentException("Event must be a JSON object");
        }
        Object type = fields.remove("type");
        Object traceparent = fields.remove("traceparent");
        return new DomainEvent(type instanceof String ? (String) type : null, fields,
                traceparent instanceof String ? (String) traceparent : null);
    }
}
