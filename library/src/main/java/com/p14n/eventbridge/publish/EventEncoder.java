package com.p14n.eventbridge.publish;

import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.p14n.eventbridge.data.DomainEvent;

/**
 * Encodes events as JSON objects holding the event's {@code type} and every
 * attribute, in attribute order.
 */
public class EventEncoder {

    private final ObjectMapper mapper;

    public EventEncoder() {
        this(new ObjectMapper());
    }

    public EventEncoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public String encode(DomainEvent event) throws JsonProcessingException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", event.type());
        for (Map.Entry<String, Object> attribute : event.attributes().entrySet()) {
            if (!"type".equals(attribute.getKey())) {
                body.put(attribute.getKey(), attribute.getValue());
            }
        }
        return mapper.writeValueAsString(body);
    }
}
