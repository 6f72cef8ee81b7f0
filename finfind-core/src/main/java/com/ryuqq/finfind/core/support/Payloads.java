package com.ryuqq.finfind.core.support;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.finfind.core.exception.ValidationException;

import java.util.Map;

/**
 * Jackson helpers for bus payloads.
 *
 * <p>Typed step requests and outputs travel over the bus as {@code Map<String, Object>};
 * this class converts between the two and measures serialized sizes.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Payloads {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .findAndRegisterModules()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    private Payloads() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Converts a typed value into a payload map.
     *
     * @param value value to convert
     * @return payload map
     * @throws IllegalArgumentException if value is null
     */
    public static Map<String, Object> toMap(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return MAPPER.convertValue(value, MAP_TYPE);
    }

    /**
     * Converts a payload map into a typed value.
     *
     * @param payload payload map
     * @param type target type
     * @param <T> target type
     * @return converted value
     * @throws ValidationException if the payload does not fit the target type
     */
    public static <T> T fromMap(Map<String, Object> payload, Class<T> type) {
        if (payload == null) {
            throw new ValidationException("payload cannot be null");
        }
        try {
            return MAPPER.convertValue(payload, type);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("payload does not match " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Returns the UTF-8 JSON size of a value in bytes.
     *
     * @param value value to measure
     * @return serialized size
     */
    public static int sizeOf(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value).length;
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
