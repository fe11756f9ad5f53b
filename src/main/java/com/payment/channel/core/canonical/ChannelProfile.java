package com.payment.channel.core.canonical;

import lombok.Builder;
import lombok.Singular;
import lombok.ToString;
import lombok.Value;

import java.util.Set;

/**
 * Everything needed to rebuild a channel's signing string: the profile row, the
 * signature field, channel-specific exclusions, and the secret when the profile
 * places it inside the string.
 */
@Value
@Builder
public class ChannelProfile {

    @Builder.Default
    CanonicalizationProfile canonicalization = CanonicalizationProfile.KEYED_DIGEST;

    @Builder.Default
    String signatureField = "sign";

    @Singular
    Set<String> excludedFields;

    @ToString.Exclude
    String secret;

    public boolean isExcluded(String field) {
        return signatureField.equals(field) || excludedFields.contains(field);
    }
}
