package com.payment.channel.core.signer;

import com.payment.channel.api.InvalidKeyMaterialException;
import com.payment.channel.api.SigningException;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;

/**
 * Keyed MAC over the canonical string; the shared secret is the MAC key and never part
 * of the string. A fresh {@link Mac} is created per call since Mac is not thread-safe.
 */
public final class HmacSigner implements Signer {

    private final String algorithm;
    private final String macAlgorithm;
    private final SecretKeySpec key;

    public HmacSigner(String algorithm, String macAlgorithm, String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new InvalidKeyMaterialException(algorithm + " requires a shared secret");
        }
        this.algorithm = algorithm;
        this.macAlgorithm = macAlgorithm;
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), macAlgorithm);
        try {
            newMac();
        } catch (GeneralSecurityException e) {
            throw new InvalidKeyMaterialException("Cannot initialise " + macAlgorithm, e);
        }
    }

    public static SignerFactory factory(String algorithm, String macAlgorithm) {
        return keyMaterial -> new HmacSigner(algorithm, macAlgorithm, keyMaterial.getSecret());
    }

    @Override
    public String sign(String content) {
        try {
            return Signatures.hex(newMac().doFinal(content.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException e) {
            throw new SigningException(macAlgorithm + " signing failed", e);
        }
    }

    @Override
    public boolean verify(String content, String signature) {
        return Signatures.hexEquals(sign(content), signature);
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    private Mac newMac() throws GeneralSecurityException {
        Mac mac = Mac.getInstance(macAlgorithm);
        mac.init(key);
        return mac;
    }
}
