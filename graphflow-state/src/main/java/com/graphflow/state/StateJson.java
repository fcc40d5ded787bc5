package com.graphflow.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * JSON serialization of state values, history entries and checkpoints. Nulls are excluded; instants are ISO-8601.
 * Values must be JSON-representable (maps, lists, strings, numbers, booleans) to round-trip.
 */
public final class StateJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private StateJson() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * @throws UncheckedIOException on parse failure
     */
    public static <T> T fromJson(String json, Class<T> type) {
        try {
            return MAPPER.readValue(json, type);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Serializes the container's values only. */
    public static String valuesToJson(StateContainer state) {
        return toJson(state.values());
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> valuesFromJson(String json) {
        return fromJson(json, Map.class);
    }
}
