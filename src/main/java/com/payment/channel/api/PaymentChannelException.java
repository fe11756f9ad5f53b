package com.payment.channel.api;

/**
 * Base type for every failure raised by the channel framework. Each subclass
 * carries a stable {@link #getCode() code} so callers can map failures to
 * {@link com.payment.channel.domain.ChannelResponse} values or log them
 * without inspecting messages.
 */
public abstract class PaymentChannelException extends RuntimeException {

    private final String code;

    protected PaymentChannelException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected PaymentChannelException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage();
    }
}
