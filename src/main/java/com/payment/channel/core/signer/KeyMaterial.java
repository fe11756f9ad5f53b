package com.payment.channel.core.signer;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

/**
 * Credentials for one channel: a shared secret, an RSA key pair in PEM, or both.
 * Read-only after construction and safe to share between signers.
 */
@Value
@Builder
public class KeyMaterial {

    @ToString.Exclude
    String secret;

    @ToString.Exclude
    String privateKeyPem;

    String publicKeyPem;

    public static KeyMaterial secret(String secret) {
        return KeyMaterial.builder().secret(secret).build();
    }

    public static KeyMaterial keyPair(String privateKeyPem, String publicKeyPem) {
        return KeyMaterial.builder().privateKeyPem(privateKeyPem).publicKeyPem(publicKeyPem).build();
    }

    public static KeyMaterial none() {
        return KeyMaterial.builder().build();
    }

    public boolean hasSecret() {
        return secret != null && !secret.isEmpty();
    }

    public boolean hasPrivateKey() {
        return privateKeyPem != null && !privateKeyPem.isBlank();
    }

    public boolean hasPublicKey() {
        return publicKeyPem != null && !publicKeyPem.isBlank();
    }
}
