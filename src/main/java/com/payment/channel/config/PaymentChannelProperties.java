package com.payment.channel.config;

import com.payment.channel.core.canonical.CanonicalizationProfile;
import com.payment.channel.domain.PaymentChannel;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Channel accounts bound from {@code payment.channels.*}:
 * <pre>
 * payment:
 *   channels:
 *     accounts:
 *       wechat-main:
 *         channel: WECHAT
 *         secret: ${WECHAT_API_KEY}
 *       alipay-main:
 *         channel: ALIPAY
 *         algorithm: RSA2
 *         private-key-location: file:/etc/payment/alipay-app-private.pem
 *         public-key-location: file:/etc/payment/alipay-public.pem
 * </pre>
 */
@Data
@Validated
@ConfigurationProperties(prefix = "payment.channels")
public class PaymentChannelProperties {

    /** Set to false to skip the auto-configuration entirely. */
    private boolean enabled = true;

    @Valid
    private Map<String, Account> accounts = new LinkedHashMap<>();

    @Data
    public static class Account {

        @NotNull
        private PaymentChannel channel;

        /** Signer registry identifier; defaults to the channel's usual algorithm. */
        private String algorithm;

        /** Canonicalization profile; defaults to the channel's usual profile. */
        private CanonicalizationProfile profile;

        @ToString.Exclude
        private String secret;

        @ToString.Exclude
        private String privateKey;

        private Resource privateKeyLocation;

        private String publicKey;

        private Resource publicKeyLocation;
    }
}
