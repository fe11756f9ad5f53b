package com.payment.channel.compliance;

/**
 * Redacts signatures and credentials so they are safe to include in logs.
 * Never log a full signature or any secret; use these masks instead.
 */
public final class SensitiveValueMasker {

    private static final String MASKED_SECRET = "******";
    private static final int SIGNATURE_PREFIX = 6;

    private SensitiveValueMasker() {}

    /** Returns a safe-to-log value for a shared secret or private key (always fully masked). */
    public static String maskSecret(String secret) {
        if (secret == null || secret.isEmpty()) return null;
        return MASKED_SECRET;
    }

    /** Returns a safe-to-log value for a signature (e.g. "F0F8FA33DF77..." -> "F0F8FA***"). */
    public static String maskSignature(String signature) {
        if (signature == null || signature.isBlank()) return null;
        if (signature.length() <= SIGNATURE_PREFIX) return "***";
        return signature.substring(0, SIGNATURE_PREFIX) + "***";
    }
}
