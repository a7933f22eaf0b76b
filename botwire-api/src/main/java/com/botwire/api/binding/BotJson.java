package com.botwire.api.binding;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared Jackson setup for the wire format: unknown properties ignored, nulls omitted.
 */
public final class BotJson {

    private BotJson() {
    }

    private static final ObjectMapper MAPPER = newMapper();

    /** Thread-safe shared mapper; do not reconfigure. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectMapper newMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
