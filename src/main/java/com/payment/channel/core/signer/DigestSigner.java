package com.payment.channel.core.signer;

import com.payment.channel.api.InvalidKeyMaterialException;
import com.payment.channel.api.SigningException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Shared-secret digest signer. The secret either already sits inside the canonical
 * string ({@link SecretMode#IN_CONTENT}, the {@code &key=SECRET} convention) or is
 * concatenated to the content right before hashing ({@link SecretMode#APPENDED}).
 * Output is upper-case hex. A secret is required in both modes; in
 * {@link SecretMode#IN_CONTENT} it is only checked for presence, the digest itself never
 * sees it unless the canonical string carries it.
 */
public final class DigestSigner implements Signer {

    public enum SecretMode {
        IN_CONTENT,
        APPENDED
    }

    private final String algorithm;
    private final String digestAlgorithm;
    private final String secret;
    private final SecretMode secretMode;

    public DigestSigner(String algorithm, String digestAlgorithm, String secret, SecretMode secretMode) {
        this.algorithm = algorithm;
        this.digestAlgorithm = digestAlgorithm;
        this.secret = secret;
        this.secretMode = secretMode;
        if (secret == null || secret.isEmpty()) {
            throw new InvalidKeyMaterialException(algorithm + " requires a shared secret");
        }
        try {
            MessageDigest.getInstance(digestAlgorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new InvalidKeyMaterialException("Digest " + digestAlgorithm + " is not available", e);
        }
    }

    /** Factory for digests whose secret is carried in the signing string. */
    public static SignerFactory inContent(String algorithm, String digestAlgorithm) {
        return keyMaterial -> new DigestSigner(algorithm, digestAlgorithm, keyMaterial.getSecret(), SecretMode.IN_CONTENT);
    }

    /** Factory for digests computed over {@code content + secret}. */
    public static SignerFactory appended(String algorithm, String digestAlgorithm) {
        return keyMaterial -> new DigestSigner(algorithm, digestAlgorithm, keyMaterial.getSecret(), SecretMode.APPENDED);
    }

    @Override
    public String sign(String content) {
        String input = secretMode == SecretMode.APPENDED ? content + secret : content;
        try {
            MessageDigest digest = MessageDigest.getInstance(digestAlgorithm);
            return Signatures.hex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new SigningException("Digest " + digestAlgorithm + " is not available", e);
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

    @Override
    public boolean expectsSecretInContent() {
        return secretMode == SecretMode.IN_CONTENT;
    }
}
