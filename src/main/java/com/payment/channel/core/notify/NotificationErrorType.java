package com.payment.channel.core.notify;

import com.payment.channel.api.PayloadFormatException;
import com.payment.channel.api.SignatureVerificationException;

/**
 * Why a notification was not acknowledged as successful.
 */
public enum NotificationErrorType {
    /** Empty, undecodable or malformed payload. */
    FORMAT_ERROR(PayloadFormatException.CODE),
    /** Missing signature or signature mismatch. */
    SIGNATURE_ERROR(SignatureVerificationException.CODE),
    /** Business callback reported failure or threw. */
    CALLBACK_FAILURE("CALLBACK_FAILURE");

    private final String code;

    NotificationErrorType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
