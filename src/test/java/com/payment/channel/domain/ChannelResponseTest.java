package com.payment.channel.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChannelResponseTest {

    @Test
    void successCarriesDataOnly() {
        ChannelResponse response = ChannelResponse.success(Map.of("trade_no", "T1"));

        assertThat(response.isSuccess()).isTrue();
        assertThat(response.isError()).isFalse();
        assertThat(response.getData()).containsEntry("trade_no", "T1");
        assertThat(response.getError()).isNull();
        assertThat(response.getCode()).isNull();
    }

    @Test
    void errorCarriesCodeAndRawBodyButNoData() {
        ChannelResponse response = ChannelResponse.error("Signature verification failed", "SIGN_ERROR", "<xml/>");

        assertThat(response.isError()).isTrue();
        assertThat(response.getData()).isNull();
        assertThat(response.getCode()).isEqualTo("SIGN_ERROR");
        assertThat(response.getRawResponse()).isEqualTo("<xml/>");
    }

    @Test
    void errorRequiresMessage() {
        assertThatThrownBy(() -> ChannelResponse.error(null, "X")).isInstanceOf(NullPointerException.class);
    }

    @Test
    void jsonOmitsNullFields() throws JsonProcessingException {
        String json = ParameterValues.mapper().writeValueAsString(ChannelResponse.error("bad", "FORMAT_ERROR"));

        assertThat(json).contains("\"success\":false", "\"error\":\"bad\"", "\"code\":\"FORMAT_ERROR\"");
        assertThat(json).doesNotContain("data", "rawResponse");
    }

    @Test
    void acknowledgementsAreFixedPerChannel() {
        assertThat(PaymentChannel.ALIPAY.acknowledge(true)).isEqualTo("success");
        assertThat(PaymentChannel.ALIPAY.acknowledge(false)).isEqualTo("failure");
        assertThat(PaymentChannel.WECHAT.acknowledge(true))
                .isEqualTo("<xml><return_code>SUCCESS</return_code><return_msg>OK</return_msg></xml>");
        assertThat(PaymentChannel.QQ.acknowledge(false)).isEqualTo(PaymentChannel.WECHAT.acknowledge(false));
    }

    @Test
    void onlyChannelsWithKnownAcknowledgementsAreModelled() {
        assertThat(PaymentChannel.values())
                .containsExactly(PaymentChannel.ALIPAY, PaymentChannel.WECHAT, PaymentChannel.QQ);
    }
}
