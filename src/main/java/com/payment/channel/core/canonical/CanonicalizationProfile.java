package com.payment.channel.core.canonical;

/**
 * The signing-string conventions shared by the supported channels. Every profile drops
 * the signature field and empty values; they differ in where the secret goes.
 */
public enum CanonicalizationProfile {

    /** MD5-style form signing: {@code a=1&b=2&key=SECRET}. */
    KEYED_DIGEST(true, JoinStyle.PAIRS, SecretPlacement.APPENDED),

    /** HMAC form signing: {@code a=1&b=2}, secret is the MAC key. */
    KEYED_MAC(true, JoinStyle.PAIRS, SecretPlacement.SIGNER_ONLY),

    /** RSA signing: {@code a=1&b=2}, private key held by the signer. */
    ASYMMETRIC(true, JoinStyle.PAIRS, SecretPlacement.SIGNER_ONLY),

    /** Value-concatenation digest: {@code 12SECRET} for fields {@code a=1, b=2}. */
    CONCATENATED_DIGEST(true, JoinStyle.VALUES, SecretPlacement.APPENDED);

    private final boolean sorted;
    private final JoinStyle joinStyle;
    private final SecretPlacement secretPlacement;

    CanonicalizationProfile(boolean sorted, JoinStyle joinStyle, SecretPlacement secretPlacement) {
        this.sorted = sorted;
        this.joinStyle = joinStyle;
        this.secretPlacement = secretPlacement;
    }

    public boolean isSorted() {
        return sorted;
    }

    public JoinStyle getJoinStyle() {
        return joinStyle;
    }

    public SecretPlacement getSecretPlacement() {
        return secretPlacement;
    }
}
