package com.payment.channel.core.signer;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Encoding and comparison helpers shared by the symmetric signers.
 */
final class Signatures {

    private static final HexFormat UPPER_HEX = HexFormat.of().withUpperCase();

    private Signatures() {}

    static String hex(byte[] bytes) {
        return UPPER_HEX.formatHex(bytes);
    }

    /**
     * Constant-time comparison of two hex signatures, ignoring case.
     */
    static boolean hexEquals(String expected, String actual) {
        if (expected == null || actual == null) {
            return false;
        }
        byte[] a = expected.toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
        byte[] b = actual.toUpperCase(Locale.ROOT).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(a, b);
    }
}
