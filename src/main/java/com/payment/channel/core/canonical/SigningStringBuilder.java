package com.payment.channel.core.canonical;

import com.payment.channel.domain.ParameterValues;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Builds the exact string a signer signs or verifies. Pure function of the fields and
 * the profile; sender and receiver must produce identical bytes.
 */
public final class SigningStringBuilder {

    /** Unsigned UTF-8 byte order, independent of locale and of UTF-16 surrogate layout. */
    static final Comparator<String> BYTEWISE = (a, b) ->
            Arrays.compareUnsigned(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));

    private SigningStringBuilder() {}

    public static String build(Map<String, ?> fields, ChannelProfile profile) {
        CanonicalizationProfile rules = profile.getCanonicalization();

        List<String> keys = new ArrayList<>();
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            // empties are re-checked: parsed provider payloads bypass the container's filter
            if (!profile.isExcluded(entry.getKey()) && !ParameterValues.isAbsent(entry.getValue())) {
                keys.add(entry.getKey());
            }
        }
        if (rules.isSorted()) {
            keys.sort(BYTEWISE);
        }

        StringBuilder text = new StringBuilder();
        for (String key : keys) {
            String value = ParameterValues.asText(fields.get(key));
            if (rules.getJoinStyle() == JoinStyle.PAIRS) {
                if (text.length() > 0) {
                    text.append('&');
                }
                text.append(key).append('=').append(value);
            } else {
                text.append(value);
            }
        }

        if (rules.getSecretPlacement() == SecretPlacement.APPENDED) {
            String secret = profile.getSecret();
            if (secret == null || secret.isEmpty()) {
                throw new IllegalArgumentException(rules + " places the secret in the signing string but none is configured");
            }
            if (rules.getJoinStyle() == JoinStyle.PAIRS) {
                if (text.length() > 0) {
                    text.append('&');
                }
                text.append("key=").append(secret);
            } else {
                text.append(secret);
            }
        }
        return text.toString();
    }
}
