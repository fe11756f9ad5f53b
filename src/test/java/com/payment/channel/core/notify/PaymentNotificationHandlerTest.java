package com.payment.channel.core.notify;

import com.payment.channel.compliance.NotificationAuditLogger;
import com.payment.channel.core.ChannelBinding;
import com.payment.channel.core.ChannelSettings;
import com.payment.channel.core.canonical.CanonicalizationProfile;
import com.payment.channel.core.signer.KeyMaterial;
import com.payment.channel.core.signer.SignerRegistry;
import com.payment.channel.domain.ParameterMap;
import com.payment.channel.domain.PaymentChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class PaymentNotificationHandlerTest {

    @Mock
    private NotificationAuditLogger auditLogger;

    private ChannelBinding alipay;
    private PaymentNotificationHandler handler;

    @BeforeEach
    void setUp() {
        SignerRegistry registry = SignerRegistry.withDefaults();
        alipay = ChannelBinding.bind(ChannelSettings.builder()
                .name("alipay-md5")
                .channel(PaymentChannel.ALIPAY)
                .algorithm(SignerRegistry.MD5)
                .profile(CanonicalizationProfile.KEYED_DIGEST)
                .keyMaterial(KeyMaterial.secret("secret"))
                .build(), registry);
        ChannelBinding qq = ChannelBinding.bind(ChannelSettings.builder()
                .name("qq-main")
                .channel(PaymentChannel.QQ)
                .keyMaterial(KeyMaterial.secret("other"))
                .build(), registry);
        handler = new PaymentNotificationHandler(List.of(alipay, qq), auditLogger);
    }

    @Test
    void routesToTheNamedBindingAndAudits() {
        String body = alipay.serialize(alipay.sign(new ParameterMap().set("out_trade_no", "A1").set("trade_status", "TRADE_SUCCESS")));

        NotificationOutcome outcome = handler.handle("alipay-md5", body, fields -> CallbackResult.success());

        assertThat(outcome.getAcknowledgement()).isEqualTo("success");
        verify(auditLogger).logOutcome("alipay-md5", outcome);
    }

    @Test
    void rejectedNotificationsAreAuditedToo() {
        NotificationOutcome outcome = handler.handle("qq-main", "<xml><out_trade_no>A1</out_trade_no></xml>",
                fields -> CallbackResult.success());

        assertThat(outcome.isRejected()).isTrue();
        assertThat(outcome.getAcknowledgement()).isEqualTo(PaymentChannel.QQ.acknowledge(false));
        verify(auditLogger).logOutcome("qq-main", outcome);
    }

    @Test
    void nullStringPayloadIsRejectedOnReceipt() {
        NotificationOutcome outcome = handler.handle("qq-main", (String) null, fields -> CallbackResult.success());

        assertThat(outcome.getRejectedAt()).isEqualTo(NotificationState.RECEIVED);
    }

    @Test
    void unknownBindingIsAConfigurationError() {
        assertThatThrownBy(() -> handler.handle("stripe", new byte[]{1}, fields -> CallbackResult.success()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("stripe")
                .hasMessageContaining("alipay-md5");
        verifyNoInteractions(auditLogger);
    }

    @Test
    void exposesVerifiersByName() {
        assertThat(handler.verifier("qq-main")).isPresent();
        assertThat(handler.verifier("missing")).isEmpty();
    }
}
