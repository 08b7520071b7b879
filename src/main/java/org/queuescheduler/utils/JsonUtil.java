package org.queuescheduler.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Shared mapper. Compact output: one record must stay on one line.
 */
public final class JsonUtil {
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(SerializationFeature.INDENT_OUTPUT)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private JsonUtil() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
