package com.reactive.xray.emit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.reactive.xray.segment.Entity;

import java.io.UncheckedIOException;

/**
 * JSON rendering of segments, as the daemon expects them.
 *
 * Usage:
 *   String json = SegmentJson.toJson(segment);
 */
public final class SegmentJson {

    private static final ObjectMapper DEFAULT_MAPPER = createDefaultMapper();

    private SegmentJson() {} // Utility class

    public static String toJson(Entity entity) {
        try {
            return DEFAULT_MAPPER.writeValueAsString(entity);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize " + entity, e);
        }
    }

    /**
     * Get the shared ObjectMapper instance.
     */
    public static ObjectMapper mapper() {
        return DEFAULT_MAPPER;
    }

    private static ObjectMapper createDefaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, true);
        return mapper;
    }
}
