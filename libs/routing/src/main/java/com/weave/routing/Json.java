package com.weave.routing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared JSON mapper for responders and model binding.
 * <p>
 * {@code java.time} values are written as ISO-8601 strings. Property matching ignores case, so
 * form field {@code name} binds to property {@code Name}.
 */
public final class Json {

    private static final ObjectMapper MAPPER = createMapper();

    private Json() {
        // utility class
    }

    private static ObjectMapper createMapper() {
        return JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Serializes {@code value} to UTF-8 JSON bytes.
     *
     * @throws JsonException if serialization fails
     */
    public static byte[] write(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new JsonException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    /** Returns the shared ObjectMapper. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Exception thrown when JSON serialization fails.
     */
    public static class JsonException extends RuntimeException {
        public JsonException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
