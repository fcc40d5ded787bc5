package com.graphflow.graph.descriptor;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON serialization of graph descriptors. Nulls are excluded when serializing.
 */
public final class GraphDescriptors {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private GraphDescriptors() {
    }

    /**
     * @throws UncheckedIOException on parse failure
     */
    public static GraphDescriptor fromJson(String json) {
        try {
            return MAPPER.readValue(json, GraphDescriptor.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static String toJson(GraphDescriptor descriptor) {
        try {
            return MAPPER.writeValueAsString(descriptor);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static String toJsonPretty(GraphDescriptor descriptor) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(descriptor);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
