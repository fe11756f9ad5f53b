package com.payment.channel.core.signer;

import com.payment.channel.api.InvalidKeyMaterialException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HmacSignerTest {

    private static final String EXPECTED = "604FE97C66C6393FF22E3CAE366EEE1131E351EBC736BF12F5D62E1755B7A233";

    @Test
    void hmacSha256MatchesReferenceVector() {
        Signer signer = HmacSigner.factory("HMAC-SHA256", "HmacSHA256").create(KeyMaterial.secret("secret"));

        assertThat(signer.sign("a=1&b=2")).isEqualTo(EXPECTED);
        assertThat(signer.verify("a=1&b=2", EXPECTED.toLowerCase())).isTrue();
        assertThat(signer.verify("a=1&b=3", EXPECTED)).isFalse();
    }

    @Test
    void differentKeyProducesDifferentSignature() {
        Signer other = new HmacSigner("HMAC-SHA256", "HmacSHA256", "other");

        assertThat(other.verify("a=1&b=2", EXPECTED)).isFalse();
    }

    @Test
    void requiresSecret() {
        assertThatThrownBy(() -> new HmacSigner("HMAC-SHA256", "HmacSHA256", ""))
                .isInstanceOf(InvalidKeyMaterialException.class)
                .hasMessageContaining("HMAC-SHA256");
    }
}
