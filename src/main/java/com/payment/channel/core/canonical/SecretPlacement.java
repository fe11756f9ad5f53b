package com.payment.channel.core.canonical;

/**
 * Whether the shared secret becomes part of the signing string or is only handed to the signer.
 */
public enum SecretPlacement {
    /** Appended as {@code &key=SECRET} (pairs) or raw (values) before signing. */
    APPENDED,
    /** Never in the string; the MAC key or private key lives in the signer. */
    SIGNER_ONLY
}
