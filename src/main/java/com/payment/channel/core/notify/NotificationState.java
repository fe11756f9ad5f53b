package com.payment.channel.core.notify;

/**
 * Steps of a single notification pass. {@link #REJECTED} is reachable from
 * {@link #RECEIVED}, {@link #PARSED} and {@link #VERIFIED}.
 */
public enum NotificationState {
    RECEIVED,
    PARSED,
    VERIFIED,
    DISPATCHED,
    ACKNOWLEDGED,
    REJECTED
}
