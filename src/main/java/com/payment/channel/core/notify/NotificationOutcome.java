package com.payment.channel.core.notify;

import com.payment.channel.domain.ChannelResponse;
import com.payment.channel.domain.PaymentChannel;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.Map;

/**
 * Result of one pass through the {@link NotificationVerifier}. {@link #getAcknowledgement()}
 * is the exact body to hand back to the provider.
 */
@Value
@Builder
public class NotificationOutcome {

    PaymentChannel channel;

    /** {@link NotificationState#ACKNOWLEDGED} or {@link NotificationState#REJECTED}. */
    NotificationState state;

    /** State in which the notification was rejected; null unless rejected. */
    NotificationState rejectedAt;

    /** Null when the callback accepted the notification. */
    NotificationErrorType errorType;

    String message;

    String acknowledgement;

    /** Parsed fields without the signature; empty when rejected before parsing. */
    @Builder.Default
    Map<String, Object> fields = Collections.emptyMap();

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isRejected() {
        return state == NotificationState.REJECTED;
    }

    public ChannelResponse toResponse() {
        if (isSuccess()) {
            return ChannelResponse.success(fields);
        }
        return ChannelResponse.error(message != null ? message : errorType.name(), errorType.getCode());
    }
}
