package com.payment.channel.compliance;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SensitiveValueMaskerTest {

    @Test
    void secretsAreAlwaysFullyMasked() {
        assertThat(SensitiveValueMasker.maskSecret("secret")).isEqualTo("******");
        assertThat(SensitiveValueMasker.maskSecret("a-much-longer-api-key-value")).isEqualTo("******");
        assertThat(SensitiveValueMasker.maskSecret("")).isNull();
        assertThat(SensitiveValueMasker.maskSecret(null)).isNull();
    }

    @Test
    void signaturesKeepAShortPrefix() {
        assertThat(SensitiveValueMasker.maskSignature("F0F8FA33DF77249D6F1A55C80F32FE44")).isEqualTo("F0F8FA***");
        assertThat(SensitiveValueMasker.maskSignature("ABC")).isEqualTo("***");
        assertThat(SensitiveValueMasker.maskSignature(" ")).isNull();
    }
}
