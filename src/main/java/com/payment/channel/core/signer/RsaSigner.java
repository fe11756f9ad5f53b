package com.payment.channel.core.signer;

import com.payment.channel.api.InvalidKeyMaterialException;
import com.payment.channel.api.SigningException;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Signature;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Base64;

/**
 * RSA PKCS#1 v1.5 signatures, Base64 encoded. The digest comes from the configured
 * {@link Profile}, never from the key.
 * <p>
 * The private key signs outbound requests; the public key (the provider's, or the one
 * derived from our private key when none is given) verifies inbound payloads.
 */
@Slf4j
public final class RsaSigner implements Signer {

    public enum Profile {
        /** SHA1withRSA, the "RSA" sign type. */
        LEGACY("SHA1withRSA"),
        /** SHA256withRSA, the "RSA2" sign type. */
        MODERN("SHA256withRSA");

        private final String jcaName;

        Profile(String jcaName) {
            this.jcaName = jcaName;
        }

        public String getJcaName() {
            return jcaName;
        }
    }

    private final String algorithm;
    private final Profile profile;
    private final RSAPrivateCrtKey privateKey;
    private final RSAPublicKey publicKey;

    public RsaSigner(String algorithm, Profile profile, KeyMaterial keyMaterial) {
        if (!keyMaterial.hasPrivateKey() && !keyMaterial.hasPublicKey()) {
            throw new InvalidKeyMaterialException(algorithm + " requires a private key, a public key, or both");
        }
        this.algorithm = algorithm;
        this.profile = profile;
        this.privateKey = keyMaterial.hasPrivateKey() ? PemKeyParser.parsePrivateKey(keyMaterial.getPrivateKeyPem()) : null;
        this.publicKey = keyMaterial.hasPublicKey()
                ? PemKeyParser.parsePublicKey(keyMaterial.getPublicKeyPem())
                : PemKeyParser.derivePublicKey(privateKey);
    }

    public static SignerFactory factory(String algorithm, Profile profile) {
        return keyMaterial -> new RsaSigner(algorithm, profile, keyMaterial);
    }

    @Override
    public String sign(String content) {
        if (privateKey == null) {
            throw new SigningException(algorithm + " signer has no private key; it can only verify");
        }
        try {
            Signature signature = Signature.getInstance(profile.getJcaName());
            signature.initSign(privateKey);
            signature.update(content.getBytes(StandardCharsets.UTF_8));
            return Base64.getEncoder().encodeToString(signature.sign());
        } catch (GeneralSecurityException e) {
            throw new SigningException(profile.getJcaName() + " signing failed", e);
        }
    }

    @Override
    public boolean verify(String content, String signature) {
        if (signature == null || signature.isBlank()) {
            return false;
        }
        try {
            byte[] signatureBytes = Base64.getMimeDecoder().decode(signature);
            Signature verifier = Signature.getInstance(profile.getJcaName());
            verifier.initVerify(publicKey);
            verifier.update(content.getBytes(StandardCharsets.UTF_8));
            return verifier.verify(signatureBytes);
        } catch (IllegalArgumentException | GeneralSecurityException e) {
            log.debug("{} verification rejected malformed signature: {}", algorithm, e.getMessage());
            return false;
        }
    }

    @Override
    public String getAlgorithm() {
        return algorithm;
    }

    public Profile getProfile() {
        return profile;
    }
}
