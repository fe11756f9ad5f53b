package com.payment.channel.core.notify;

import com.payment.channel.api.PayloadFormatException;
import com.payment.channel.api.PaymentChannelException;
import com.payment.channel.core.ChannelBinding;
import com.payment.channel.core.WirePayloadParser;
import com.payment.channel.domain.ParameterValues;
import com.payment.channel.domain.PaymentChannel;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Verifies inbound provider notifications and turns the caller's business outcome into
 * the channel's acknowledgement body.
 * <p>
 * Each call is one pass of RECEIVED → PARSED → VERIFIED → DISPATCHED → ACKNOWLEDGED;
 * payload and signature problems end in REJECTED. Nothing is ever thrown to the
 * transport: providers retry until they get an acknowledgement, so every path returns
 * one. No state is kept between calls and no deduplication is performed.
 */
@Slf4j
public class NotificationVerifier {

    private final ChannelBinding binding;

    public NotificationVerifier(ChannelBinding binding) {
        this.binding = binding;
    }

    public NotificationOutcome process(byte[] rawPayload, NotificationCallback callback) {
        PaymentChannel channel = binding.getChannel();

        // RECEIVED
        if (rawPayload == null || rawPayload.length == 0) {
            return reject(NotificationState.RECEIVED, NotificationErrorType.FORMAT_ERROR, "Empty notification payload");
        }

        // PARSED
        Map<String, Object> fields;
        try {
            fields = WirePayloadParser.parse(WirePayloadParser.decodeUtf8(rawPayload), channel);
        } catch (PayloadFormatException e) {
            log.warn("Unparseable {} notification for binding={}: {}", channel, binding.getName(), e.getMessage());
            return reject(NotificationState.PARSED, NotificationErrorType.FORMAT_ERROR, e.getMessage());
        }

        // VERIFIED
        String signatureField = binding.getProfile().getSignatureField();
        String signature = ParameterValues.asText(fields.remove(signatureField));
        if (signature == null || signature.isBlank()) {
            log.warn("{} notification for binding={} has no '{}' field", channel, binding.getName(), signatureField);
            return reject(NotificationState.VERIFIED, NotificationErrorType.SIGNATURE_ERROR,
                    "Missing signature field '" + signatureField + "'");
        }
        try {
            if (!binding.verifySignature(fields, signature)) {
                return reject(NotificationState.VERIFIED, NotificationErrorType.SIGNATURE_ERROR, "Signature verification failed");
            }
        } catch (PaymentChannelException | IllegalArgumentException e) {
            log.error("Signature check errored for binding={}", binding.getName(), e);
            return reject(NotificationState.VERIFIED, NotificationErrorType.SIGNATURE_ERROR, e.getMessage());
        }

        // DISPATCHED
        Map<String, Object> verified = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        CallbackResult result;
        try {
            result = callback.handle(verified);
        } catch (RuntimeException e) {
            log.error("Notification callback threw for binding={}; answering with failure acknowledgement",
                    binding.getName(), e);
            result = CallbackResult.failure("callback error: " + e.getMessage());
        }
        if (result == null) {
            result = CallbackResult.failure("callback returned no result");
        }

        // ACKNOWLEDGED
        NotificationOutcome.NotificationOutcomeBuilder outcome = NotificationOutcome.builder()
                .channel(channel)
                .state(NotificationState.ACKNOWLEDGED)
                .acknowledgement(channel.acknowledge(result.isSuccess()))
                .fields(verified);
        if (!result.isSuccess()) {
            outcome.errorType(NotificationErrorType.CALLBACK_FAILURE).message(result.getReason());
        }
        return outcome.build();
    }

    public ChannelBinding getBinding() {
        return binding;
    }

    private NotificationOutcome reject(NotificationState at, NotificationErrorType errorType, String message) {
        return NotificationOutcome.builder()
                .channel(binding.getChannel())
                .state(NotificationState.REJECTED)
                .rejectedAt(at)
                .errorType(errorType)
                .message(message)
                .acknowledgement(binding.getChannel().acknowledge(false))
                .build();
    }
}
