package com.payment.channel.api;

/**
 * Thrown when an outbound signature cannot be produced. Never swallowed: a request that
 * cannot be signed must not reach the network.
 */
public class SigningException extends PaymentChannelException {

    public static final String CODE = "SIGNING_ERROR";

    public SigningException(String message) {
        super(CODE, message);
    }

    public SigningException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
