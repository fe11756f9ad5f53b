package com.payment.channel.api;

/**
 * Thrown at configuration time when key material cannot be shaped into what a signer needs
 * (missing shared secret, unreadable PEM, wrong key type).
 */
public class InvalidKeyMaterialException extends PaymentChannelException {

    public static final String CODE = "INVALID_KEY_MATERIAL";

    public InvalidKeyMaterialException(String message) {
        super(CODE, message);
    }

    public InvalidKeyMaterialException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
