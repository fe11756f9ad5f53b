package com.payment.channel.config;

import com.payment.channel.api.InvalidKeyMaterialException;
import com.payment.channel.api.PaymentChannelException;
import com.payment.channel.compliance.NotificationAuditLogger;
import com.payment.channel.compliance.SensitiveValueMasker;
import com.payment.channel.core.ChannelBinding;
import com.payment.channel.core.ChannelSettings;
import com.payment.channel.core.notify.PaymentNotificationHandler;
import com.payment.channel.core.signer.KeyMaterial;
import com.payment.channel.core.signer.SignerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.Resource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Assembles the default {@link SignerRegistry} and binds every configured channel
 * account at startup, so bad algorithms or key material stop the application before
 * any request is signed.
 */
@Slf4j
@AutoConfiguration
@ConditionalOnProperty(name = "payment.channels.enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PaymentChannelProperties.class)
public class PaymentChannelAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SignerRegistry signerRegistry(ObjectProvider<SignerRegistration> registrations) {
        SignerRegistry registry = SignerRegistry.withDefaults();
        registrations.orderedStream().forEach(registration -> {
            log.info("Registering custom signer algorithm={}", registration.getAlgorithm());
            registry.register(registration.getAlgorithm(), registration.getFactory());
        });
        log.info("Signer registry initialised with algorithms={}", registry.identifiers());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ChannelBindings channelBindings(PaymentChannelProperties properties, SignerRegistry signerRegistry) {
        List<ChannelBinding> bindings = new ArrayList<>();
        for (Map.Entry<String, PaymentChannelProperties.Account> entry : properties.getAccounts().entrySet()) {
            String name = entry.getKey();
            PaymentChannelProperties.Account account = entry.getValue();
            ChannelSettings settings = ChannelSettings.builder()
                    .name(name)
                    .channel(account.getChannel())
                    .algorithm(account.getAlgorithm())
                    .profile(account.getProfile())
                    .keyMaterial(keyMaterial(name, account))
                    .build();
            try {
                bindings.add(ChannelBinding.bind(settings, signerRegistry));
            } catch (PaymentChannelException e) {
                log.error("Invalid payment channel configuration name={} channel={} algorithm={} code={}",
                        name, account.getChannel(), settings.getEffectiveAlgorithm(), e.getCode());
                throw e;
            }
            log.info("Configured payment channel name={} channel={} algorithm={} profile={} secret={}",
                    name, account.getChannel(), settings.getEffectiveAlgorithm(), settings.getEffectiveProfile(),
                    SensitiveValueMasker.maskSecret(account.getSecret()));
        }
        if (bindings.isEmpty()) {
            log.warn("No payment channel accounts configured under payment.channels.accounts");
        }
        return new ChannelBindings(bindings);
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationAuditLogger notificationAuditLogger() {
        return new NotificationAuditLogger();
    }

    @Bean
    @ConditionalOnMissingBean
    public PaymentNotificationHandler paymentNotificationHandler(ChannelBindings channelBindings,
                                                                 NotificationAuditLogger notificationAuditLogger) {
        return new PaymentNotificationHandler(channelBindings.all(), notificationAuditLogger);
    }

    /**
     * Inline PEM text wins over a configured location.
     */
    static KeyMaterial keyMaterial(String name, PaymentChannelProperties.Account account) {
        return KeyMaterial.builder()
                .secret(account.getSecret())
                .privateKeyPem(firstNonBlank(account.getPrivateKey(), read(name, account.getPrivateKeyLocation())))
                .publicKeyPem(firstNonBlank(account.getPublicKey(), read(name, account.getPublicKeyLocation())))
                .build();
    }

    private static String read(String name, Resource resource) {
        if (resource == null) {
            return null;
        }
        try (InputStream in = resource.getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new InvalidKeyMaterialException("Cannot read key for channel " + name + " from " + resource.getDescription(), e);
        }
    }

    private static String firstNonBlank(String first, String second) {
        return first != null && !first.isBlank() ? first : second;
    }
}
