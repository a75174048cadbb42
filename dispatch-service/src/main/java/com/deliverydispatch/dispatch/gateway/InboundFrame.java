package com.deliverydispatch.dispatch.gateway;

import com.deliverydispatch.dispatch.exception.DispatchErrorCode;
import com.deliverydispatch.dispatch.exception.InvalidEventException;
import com.deliverydispatch.shared.model.GeoPoint;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * A client-to-server frame: {@code {"type": ..., "data": {...}}}.
 */
public record InboundFrame(String type, JsonNode data) {

    public static InboundFrame parse(ObjectMapper objectMapper, String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new InvalidEventException("Frame is not valid JSON");
        }
        if (root == null || !root.isObject() || !root.path("type").isTextual()) {
            throw new InvalidEventException("Frame must be an object with a string 'type'");
        }
        JsonNode data = root.get("data");
        if (data == null || data.isNull()) {
            data = JsonNodeFactory.instance.objectNode();
        } else if (!data.isObject()) {
            throw new InvalidEventException("'data' must be an object");
        }
        return new InboundFrame(root.get("type").asText(), data);
    }

    public long requireLong(String field) {
        JsonNode node = data.get(field);
        if (node == null || !node.isIntegralNumber() || !node.canConvertToLong()) {
            throw new InvalidEventException("'" + field + "' must be an integer");
        }
        return node.asLong();
    }

    public double requireDouble(String field) {
        JsonNode node = data.get(field);
        if (node == null || !node.isNumber()) {
            throw new InvalidEventException(DispatchErrorCode.INVALID_LOCATION, "'" + field + "' must be a number");
        }
        return node.asDouble();
    }

    public Double optionalDouble(String field) {
        JsonNode node = data.get(field);
        return node != null && node.isNumber() ? node.asDouble() : null;
    }

    public String optionalText(String field) {
        JsonNode node = data.get(field);
        return node != null && node.isTextual() && !node.asText().isBlank() ? node.asText() : null;
    }

    /** Reads {@code lat}/{@code lon} as a validated point. */
    public GeoPoint requireLocation() {
        try {
            return GeoPoint.of(requireDouble("lat"), requireDouble("lon"));
        } catch (IllegalArgumentException e) {
            throw new InvalidEventException(DispatchErrorCode.INVALID_LOCATION, e.getMessage());
        }
    }
}
