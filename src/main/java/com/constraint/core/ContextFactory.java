package com.constraint.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory for model and state values from JSON payloads or plain objects.
 * Nested objects stay nested, so {"order":{"total":5}} is reached as {@code $order.total}.
 */
public class ContextFactory {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parse a JSON object into a map.
     *
     * @param json JSON object text; null or blank yields an empty map
     * @return Parsed map, keys in document order
     * @throws IllegalArgumentException if the text is not a JSON object
     */
    public static Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Convert a bean or record into a map of its properties, recursively.
     *
     * @param value Object to convert; null yields an empty map
     * @return Property map
     * @throws IllegalArgumentException if the object does not convert to a JSON object
     */
    public static Map<String, Object> fromObject(Object value) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        return objectMapper.convertValue(value, new TypeReference<LinkedHashMap<String, Object>>() {});
    }
}
