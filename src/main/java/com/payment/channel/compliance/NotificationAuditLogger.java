package com.payment.channel.compliance;

import com.payment.channel.core.notify.NotificationOutcome;
import lombok.extern.slf4j.Slf4j;

/**
 * Logs every inbound notification outcome for audit. Providers re-deliver
 * notifications, so the same trade number may legitimately appear several times.
 * Can be extended to write to a dedicated audit store.
 */
@Slf4j
public class NotificationAuditLogger {

    private static final String TRADE_NO_FIELD = "out_trade_no";

    public void logOutcome(String bindingName, NotificationOutcome outcome) {
        Object tradeNo = outcome.getFields().get(TRADE_NO_FIELD);
        if (outcome.isSuccess()) {
            log.info("[AUDIT] NOTIFICATION_ACCEPTED binding={} channel={} outTradeNo={}",
                    bindingName, outcome.getChannel(), tradeNo);
        } else {
            log.warn("[AUDIT] NOTIFICATION_FAILED binding={} channel={} state={} rejectedAt={} errorType={} outTradeNo={} message={}",
                    bindingName,
                    outcome.getChannel(),
                    outcome.getState(),
                    outcome.getRejectedAt(),
                    outcome.getErrorType(),
                    tradeNo,
                    outcome.getMessage());
        }
    }
}
