package com.payment.channel.core.notify;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Business outcome returned by a {@link NotificationCallback}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class CallbackResult {

    private static final CallbackResult SUCCESS = new CallbackResult(true, null);

    boolean success;
    String reason;

    public static CallbackResult success() {
        return SUCCESS;
    }

    public static CallbackResult failure(String reason) {
        return new CallbackResult(false, reason);
    }

    public static CallbackResult of(boolean success) {
        return success ? SUCCESS : failure("callback returned false");
    }
}
