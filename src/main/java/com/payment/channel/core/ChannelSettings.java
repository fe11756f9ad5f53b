package com.payment.channel.core;

import com.payment.channel.core.canonical.CanonicalizationProfile;
import com.payment.channel.core.signer.KeyMaterial;
import com.payment.channel.domain.PaymentChannel;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Configuration of one merchant account on one channel, as supplied by the
 * configuration layer. Algorithm and profile fall back to the channel defaults.
 */
@Value
@Builder
public class ChannelSettings {

    /** Logical name used to look the binding up, e.g. {@code wechat-main}. */
    @NonNull
    String name;

    @NonNull
    PaymentChannel channel;

    String algorithm;

    CanonicalizationProfile profile;

    @Builder.Default
    KeyMaterial keyMaterial = KeyMaterial.none();

    public String getEffectiveAlgorithm() {
        return algorithm != null && !algorithm.isBlank() ? algorithm : channel.getDefaultAlgorithm();
    }

    public CanonicalizationProfile getEffectiveProfile() {
        return profile != null ? profile : channel.getDefaultProfile();
    }
}
