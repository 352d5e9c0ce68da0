package com.taskherd.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes the JSON text columns (params, results) of jobs and schedules.
 */
@Component
public class JsonColumns {

    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper json;

    public JsonColumns(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    /** @throws IllegalArgumentException if the value cannot be serialized */
    public String write(Map<String, ?> value) {
        try {
            return json.writeValueAsString(value == null ? Map.of() : value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value is not JSON-serializable: " + e.getOriginalMessage(), e);
        }
    }

    /** Null or blank text decodes to an empty map. */
    public Map<String, Object> readMap(String text) {
        if (text == null || text.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return json.readValue(text, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored JSON is not an object: " + e.getOriginalMessage(), e);
        }
    }
}
