package com.payment.channel.core.notify;

import com.payment.channel.compliance.NotificationAuditLogger;
import com.payment.channel.core.ChannelBinding;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for the transport layer: route raw notification bytes to the verifier of
 * a configured binding and return the acknowledgement body to write back.
 * <pre>
 * String body = handler.handle("wechat-main", requestBytes, fields -&gt; orders.markPaid(fields))
 *         .getAcknowledgement();
 * </pre>
 */
@Slf4j
public class PaymentNotificationHandler {

    private final Map<String, NotificationVerifier> verifiers;
    private final NotificationAuditLogger auditLogger;

    public PaymentNotificationHandler(Collection<ChannelBinding> bindings, NotificationAuditLogger auditLogger) {
        this.auditLogger = auditLogger;
        this.verifiers = new LinkedHashMap<>();
        for (ChannelBinding binding : bindings) {
            verifiers.put(binding.getName(), new NotificationVerifier(binding));
        }
        log.info("Notification handler ready for bindings={}", verifiers.keySet());
    }

    /**
     * @throws IllegalArgumentException if no binding is configured under {@code bindingName};
     *                                  that is a deployment error, not a provider condition
     */
    public NotificationOutcome handle(String bindingName, byte[] rawPayload, NotificationCallback callback) {
        NotificationVerifier verifier = verifier(bindingName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown payment channel binding: " + bindingName + ". Available: " + verifiers.keySet()));
        NotificationOutcome outcome = verifier.process(rawPayload, callback);
        auditLogger.logOutcome(bindingName, outcome);
        return outcome;
    }

    public NotificationOutcome handle(String bindingName, String rawPayload, NotificationCallback callback) {
        byte[] bytes = rawPayload == null ? null : rawPayload.getBytes(StandardCharsets.UTF_8);
        return handle(bindingName, bytes, callback);
    }

    public Optional<NotificationVerifier> verifier(String bindingName) {
        return Optional.ofNullable(verifiers.get(bindingName));
    }
}
