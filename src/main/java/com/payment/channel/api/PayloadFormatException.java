package com.payment.channel.api;

/**
 * Thrown when form, XML or JSON text cannot be decoded into a parameter container.
 */
public class PayloadFormatException extends PaymentChannelException {

    public static final String CODE = "FORMAT_ERROR";

    public PayloadFormatException(String message) {
        super(CODE, message);
    }

    public PayloadFormatException(String message, Throwable cause) {
        super(CODE, message, cause);
    }
}
