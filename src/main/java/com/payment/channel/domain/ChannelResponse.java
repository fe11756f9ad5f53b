package com.payment.channel.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Uniform outcome of a channel operation. Expected failures (bad signature, malformed
 * provider payload) are reported here instead of being thrown.
 * <p>
 * A successful response never carries {@code error}/{@code code}; a failed one never
 * carries {@code data}. Only the factory methods create instances.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChannelResponse {

    boolean success;
    Map<String, Object> data;
    String error;
    String code;
    /** Body exactly as received from the provider, for troubleshooting. */
    String rawResponse;

    public static ChannelResponse success(Map<String, ?> data) {
        return success(data, null);
    }

    public static ChannelResponse success(Map<String, ?> data, String rawResponse) {
        Map<String, Object> copy = data == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        return new ChannelResponse(true, copy, null, null, rawResponse);
    }

    public static ChannelResponse error(String error, String code) {
        return error(error, code, null);
    }

    public static ChannelResponse error(String error, String code, String rawResponse) {
        Objects.requireNonNull(error, "error");
        return new ChannelResponse(false, null, error, code, rawResponse);
    }

    public boolean isError() {
        return !success;
    }
}
