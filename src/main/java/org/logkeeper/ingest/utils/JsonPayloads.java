package org.logkeeper.ingest.utils;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON conversion of the semi-structured event payloads stored in JSON columns.
 */
public final class JsonPayloads {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonPayloads() {
        // Utility class
    }

    /**
     * Serializes a payload map.
     *
     * @param payload The payload, may be empty.
     * @return The JSON text.
     * @throws JsonProcessingException if a value cannot be serialized.
     */
    public static String toJson(Map<String, Object> payload) throws JsonProcessingException {
        return MAPPER.writeValueAsString(payload == null ? Collections.emptyMap() : payload);
    }

    /**
     * Parses a payload map.
     *
     * @param json The JSON text, may be {@code null}.
     * @return The map, empty for {@code null} input.
     * @throws JsonProcessingException if the text is not a JSON object.
     */
    public static Map<String, Object> fromJson(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        return MAPPER.readValue(json, MAP_TYPE);
    }
}
