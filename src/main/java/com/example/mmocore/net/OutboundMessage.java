package com.example.mmocore.net;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One outbound event: a tagged variant ({@link EventType}) plus its payload.
 * The payload is immutable and keeps insertion order.
 */
public record OutboundMessage(EventType type, Map<String, Object> payload) {

    public OutboundMessage {
        if (type == null) throw new IllegalArgumentException("type must not be null");
        Map<String, Object> copy = payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload);
        for (String field : type.getRequiredFields()) {
            if (!copy.containsKey(field)) {
                throw new IllegalArgumentException(type.getWireName() + " is missing required field '" + field + "'");
            }
        }
        payload = Collections.unmodifiableMap(copy);
    }

    public String wireName() {
        return type.getWireName();
    }

    public Object get(String field) {
        return payload.get(field);
    }

    public static Builder builder(EventType type) {
        return new Builder(type);
    }

    /**
     * Fluent payload builder. Null values are allowed.
     */
    public static final class Builder {
        private final EventType type;
        private final Map<String, Object> payload = new LinkedHashMap<>();

        private Builder(EventType type) {
            this.type = type;
        }

        public Builder put(String key, Object value) {
            payload.put(key, value);
            return this;
        }

        public Builder putAll(Map<String, ?> values) {
            payload.putAll(values);
            return this;
        }

        public OutboundMessage build() {
            return new OutboundMessage(type, payload);
        }
    }
}
