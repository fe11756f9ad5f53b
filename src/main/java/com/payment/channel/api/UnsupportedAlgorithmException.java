package com.payment.channel.api;

/**
 * Thrown at configuration time when an algorithm identifier has no registered signer factory.
 */
public class UnsupportedAlgorithmException extends PaymentChannelException {

    public static final String CODE = "UNSUPPORTED_ALGORITHM";

    private final String algorithm;

    public UnsupportedAlgorithmException(String algorithm) {
        super(CODE, "Unsupported signing algorithm: " + algorithm);
        this.algorithm = algorithm;
    }

    public String getAlgorithm() {
        return algorithm;
    }
}
