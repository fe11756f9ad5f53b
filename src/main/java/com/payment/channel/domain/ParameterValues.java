package com.payment.channel.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;

/**
 * Shared rules for turning container values into text, and the JSON mapper used by
 * containers and wire codecs. The mapper is configured once and is thread-safe.
 */
public final class ParameterValues {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private ParameterValues() {}

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /** True for values a container never stores: null and the empty string. */
    public static boolean isAbsent(Object value) {
        return value == null || (value instanceof CharSequence && ((CharSequence) value).length() == 0);
    }

    /**
     * Renders a value the way it appears in signing strings and text documents.
     * Nested maps, containers and collections become compact JSON.
     */
    public static String asText(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof CharSequence) {
            return value.toString();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof ParameterMap || value instanceof Map || value instanceof Collection) {
            return toJson(value);
        }
        return value.toString();
    }

    static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize value to JSON", e);
        }
    }
}
