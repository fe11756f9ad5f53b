package com.payment.channel.core.signer;

/**
 * Signs canonical strings and verifies signatures over them. Callers see only this
 * contract; which variant backs an algorithm identifier is decided by the
 * {@link SignerRegistry}.
 * <p>
 * Implementations are immutable and safe to share between threads.
 */
public interface Signer {

    /**
     * @param content canonical signing string
     * @return signature text (hex for digests and MACs, Base64 for RSA)
     * @throws com.payment.channel.api.SigningException if this signer cannot sign
     */
    String sign(String content);

    /**
     * Checks {@code signature} against {@code content}. Malformed signature text yields
     * {@code false}, never an exception.
     */
    boolean verify(String content, String signature);

    /** Algorithm identifier this signer was registered under, for logging. */
    String getAlgorithm();

    /**
     * True when the signer holds no key of its own and relies on the shared secret
     * already being part of the signing string, as plain digests do. Such a signer is
     * only safe with a profile that appends the secret.
     */
    default boolean expectsSecretInContent() {
        return false;
    }
}
