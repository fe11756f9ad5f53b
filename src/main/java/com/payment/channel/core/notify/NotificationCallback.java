package com.payment.channel.core.notify;

import java.util.Map;
import java.util.function.Predicate;

/**
 * Caller logic run once a notification's signature has been verified.
 * <p>
 * Report expected business conditions through {@link CallbackResult#failure(String)}
 * rather than by throwing. Anything thrown is still caught by the
 * {@link NotificationVerifier} and answered with the channel's failure acknowledgement.
 * <p>
 * Providers re-deliver notifications when they miss an acknowledgement, so
 * implementations must tolerate seeing the same notification more than once.
 */
@FunctionalInterface
public interface NotificationCallback {

    /**
     * @param fields verified notification fields in arrival order, without the signature field
     */
    CallbackResult handle(Map<String, Object> fields);

    static NotificationCallback fromPredicate(Predicate<Map<String, Object>> predicate) {
        return fields -> CallbackResult.of(predicate.test(fields));
    }
}
