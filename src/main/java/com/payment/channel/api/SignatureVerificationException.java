package com.payment.channel.api;

/**
 * Thrown when a signature is missing or does not match the canonical signing string.
 */
public class SignatureVerificationException extends PaymentChannelException {

    public static final String CODE = "SIGN_ERROR";

    public SignatureVerificationException(String message) {
        super(CODE, message);
    }

    public SignatureVerificationException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
