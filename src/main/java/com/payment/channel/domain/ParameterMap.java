package com.payment.channel.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.payment.channel.api.PayloadFormatException;
import com.payment.channel.core.canonical.ChannelProfile;
import com.payment.channel.core.canonical.SigningStringBuilder;

import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Ordered request/response parameters for a single provider call. Setting a null or
 * empty-string value is a no-op, so callers can pass optional fields without
 * checking them first:
 * <pre>
 * ParameterMap params = new ParameterMap()
 *         .set("out_trade_no", orderNo)
 *         .set("attach", maybeNull);
 * </pre>
 * Not thread-safe; one instance belongs to one call site.
 */
public class ParameterMap {

    private final LinkedHashMap<String, Object> values = new LinkedHashMap<>();

    public static ParameterMap of(Map<String, ?> source) {
        return new ParameterMap().setAll(source);
    }

    /**
     * Parses a JSON object. Nested objects and arrays are kept as maps and lists.
     */
    public static ParameterMap fromJson(String json) {
        if (json == null || json.isBlank()) {
            throw new PayloadFormatException("JSON payload is empty");
        }
        try {
            Map<String, Object> parsed = ParameterValues.mapper()
                    .readValue(json, new TypeReference<LinkedHashMap<String, Object>>() {});
            if (parsed == null) {
                throw new PayloadFormatException("JSON payload is not an object");
            }
            return of(parsed);
        } catch (JsonProcessingException e) {
            throw new PayloadFormatException("Malformed JSON payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses {@code a=1&b=2} form text. When a key repeats, the first value wins.
     */
    public static ParameterMap fromQueryString(String query) {
        ParameterMap map = new ParameterMap();
        decodeForm(query).forEach(map::set);
        return map;
    }

    /**
     * Decodes form text into raw pairs, keeping empty values. Used where the caller
     * must see exactly what the provider sent.
     */
    public static Map<String, String> decodeForm(String query) {
        Map<String, String> pairs = new LinkedHashMap<>();
        if (query == null || query.isEmpty()) {
            return pairs;
        }
        for (String pair : query.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String rawKey = eq < 0 ? pair : pair.substring(0, eq);
            String rawValue = eq < 0 ? "" : pair.substring(eq + 1);
            try {
                String key = URLDecoder.decode(rawKey, StandardCharsets.UTF_8);
                String value = URLDecoder.decode(rawValue, StandardCharsets.UTF_8);
                pairs.putIfAbsent(key, value);
            } catch (IllegalArgumentException e) {
                throw new PayloadFormatException("Malformed form field: " + rawKey, e);
            }
        }
        return pairs;
    }

    public ParameterMap set(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (!ParameterValues.isAbsent(value)) {
            values.put(key, value);
        }
        return this;
    }

    public ParameterMap setAll(Map<String, ?> source) {
        if (source != null) {
            source.forEach(this::set);
        }
        return this;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public Object get(String key, Object defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    /**
     * Typed lookup; a stored value of another type yields {@code defaultValue}.
     */
    public <T> T get(String key, Class<T> type, T defaultValue) {
        Object value = values.get(key);
        return type.isInstance(value) ? type.cast(value) : defaultValue;
    }

    /** Value rendered as text, or null when absent. */
    public String getString(String key) {
        return ParameterValues.asText(values.get(key));
    }

    public ParameterMap remove(String key) {
        values.remove(key);
        return this;
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public ParameterMap clear() {
        values.clear();
        return this;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public Set<String> keys() {
        return Collections.unmodifiableSet(values.keySet());
    }

    @JsonValue
    public Map<String, Object> toMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public String toJson() {
        return ParameterValues.toJson(values);
    }

    /**
     * Transport encoding: insertion order, RFC 3986 percent-encoding. Not a signing string.
     */
    public String toQueryString() {
        StringJoiner joiner = new StringJoiner("&");
        values.forEach((key, value) -> joiner.add(percentEncode(key) + "=" + percentEncode(ParameterValues.asText(value))));
        return joiner.toString();
    }

    public String toSigningText(ChannelProfile profile) {
        return SigningStringBuilder.build(values, profile);
    }

    static String percentEncode(String text) {
        return URLEncoder.encode(text, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ParameterMap)) return false;
        return values.equals(((ParameterMap) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ParameterMap" + values;
    }
}
