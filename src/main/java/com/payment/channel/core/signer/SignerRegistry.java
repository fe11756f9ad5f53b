package com.payment.channel.core.signer;

import com.payment.channel.api.UnsupportedAlgorithmException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Algorithm identifier → {@link SignerFactory}. Identifiers are case-sensitive;
 * registering an existing identifier replaces it.
 * <p>
 * Each update publishes a new immutable map, so readers never see a half-written entry.
 * Pass the registry explicitly to the code that binds channels; only the outermost
 * assembly point should create the shared default instance.
 */
@Slf4j
public class SignerRegistry {

    public static final String MD5 = "MD5";
    public static final String SHA256 = "SHA256";
    public static final String HMAC_SHA256 = "HMAC-SHA256";
    public static final String RSA = "RSA";
    public static final String RSA2 = "RSA2";

    private final AtomicReference<Map<String, SignerFactory>> factories =
            new AtomicReference<>(Collections.emptyMap());

    public static SignerRegistry empty() {
        return new SignerRegistry();
    }

    /**
     * Registry with the built-in algorithms: {@value #MD5} and {@value #SHA256} (secret in
     * the signing string), {@value #HMAC_SHA256}, {@value #RSA} (SHA1withRSA) and
     * {@value #RSA2} (SHA256withRSA).
     */
    public static SignerRegistry withDefaults() {
        return new SignerRegistry()
                .register(MD5, DigestSigner.inContent(MD5, "MD5"))
                .register(SHA256, DigestSigner.inContent(SHA256, "SHA-256"))
                .register(HMAC_SHA256, HmacSigner.factory(HMAC_SHA256, "HmacSHA256"))
                .register(RSA, RsaSigner.factory(RSA, RsaSigner.Profile.LEGACY))
                .register(RSA2, RsaSigner.factory(RSA2, RsaSigner.Profile.MODERN));
    }

    public SignerRegistry register(String identifier, SignerFactory factory) {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(factory, "factory");
        Map<String, SignerFactory> previous = factories.getAndUpdate(current -> {
            Map<String, SignerFactory> next = new LinkedHashMap<>(current);
            next.put(identifier, factory);
            return Collections.unmodifiableMap(next);
        });
        if (previous.containsKey(identifier)) {
            log.info("Replaced signer factory for algorithm={}", identifier);
        } else {
            log.debug("Registered signer factory for algorithm={}", identifier);
        }
        return this;
    }

    /**
     * Builds a signer for {@code identifier}, validating the key material now.
     *
     * @throws UnsupportedAlgorithmException if nothing is registered under the identifier
     * @throws com.payment.channel.api.InvalidKeyMaterialException if the key material does not fit
     */
    public Signer get(String identifier, KeyMaterial keyMaterial) {
        SignerFactory factory = identifier == null ? null : factories.get().get(identifier);
        if (factory == null) {
            throw new UnsupportedAlgorithmException(identifier);
        }
        return factory.create(keyMaterial == null ? KeyMaterial.none() : keyMaterial);
    }

    public boolean isRegistered(String identifier) {
        return factories.get().containsKey(identifier);
    }

    public Set<String> identifiers() {
        return factories.get().keySet();
    }
}
