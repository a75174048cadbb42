package com.deliverydispatch.dispatch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A server-to-client frame: {@code {"type": ..., "data": {...}}}.
 */
public record OutboundEvent(String type, Map<String, Object> data) {

    public OutboundEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static Builder builder(String type) {
        return new Builder(type);
    }

    public static final class Builder {

        private final String type;
        private final Map<String, Object> data = new LinkedHashMap<>();

        private Builder(String type) {
            this.type = type;
        }

        public Builder put(String key, Object value) {
            data.put(key, value);
            return this;
        }

        /** Optional fields are omitted from the frame rather than sent as null. */
        public Builder putIfPresent(String key, Object value) {
            if (value != null) {
                data.put(key, value);
            }
            return this;
        }

        public OutboundEvent build() {
            return new OutboundEvent(type, data);
        }
    }
}
