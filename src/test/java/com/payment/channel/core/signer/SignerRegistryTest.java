package com.payment.channel.core.signer;

import com.payment.channel.api.InvalidKeyMaterialException;
import com.payment.channel.api.UnsupportedAlgorithmException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignerRegistryTest {

    private final SignerRegistry registry = SignerRegistry.withDefaults();

    @Test
    void defaultsCoverBuiltInAlgorithms() {
        assertThat(registry.identifiers())
                .containsExactly(SignerRegistry.MD5, SignerRegistry.SHA256, SignerRegistry.HMAC_SHA256,
                        SignerRegistry.RSA, SignerRegistry.RSA2);
    }

    @Test
    void unknownIdentifierIsUnsupported() {
        assertThatThrownBy(() -> registry.get("FOO", KeyMaterial.secret("k")))
                .isInstanceOf(UnsupportedAlgorithmException.class)
                .satisfies(e -> {
                    UnsupportedAlgorithmException unsupported = (UnsupportedAlgorithmException) e;
                    assertThat(unsupported.getAlgorithm()).isEqualTo("FOO");
                    assertThat(unsupported.getCode()).isEqualTo(UnsupportedAlgorithmException.CODE);
                });
    }

    @Test
    void identifiersAreCaseSensitive() {
        assertThat(registry.isRegistered("md5")).isFalse();
        assertThatThrownBy(() -> registry.get("md5", KeyMaterial.secret("k")))
                .isInstanceOf(UnsupportedAlgorithmException.class);
    }

    @Test
    void nullIdentifierIsUnsupported() {
        assertThatThrownBy(() -> registry.get(null, KeyMaterial.none()))
                .isInstanceOf(UnsupportedAlgorithmException.class);
    }

    @Test
    void registeringNewIdentifierMakesItAvailable() {
        SignerRegistry custom = SignerRegistry.empty()
                .register("MD5-APPENDED", DigestSigner.appended("MD5-APPENDED", "MD5"));

        Signer signer = custom.get("MD5-APPENDED", KeyMaterial.secret("c"));

        assertThat(signer.sign("ab")).isEqualTo("900150983CD24FB0D6963F7D28E17F72");
    }

    @Test
    void registeringExistingIdentifierReplacesIt() {
        Signer fixed = new Signer() {
            @Override
            public String sign(String content) {
                return "FIXED";
            }

            @Override
            public boolean verify(String content, String signature) {
                return "FIXED".equals(signature);
            }

            @Override
            public String getAlgorithm() {
                return SignerRegistry.MD5;
            }
        };

        registry.register(SignerRegistry.MD5, keyMaterial -> fixed);

        assertThat(registry.get(SignerRegistry.MD5, KeyMaterial.none()).sign("anything")).isEqualTo("FIXED");
        assertThat(registry.identifiers()).hasSize(5);
    }

    @Test
    void keyMaterialIsValidatedWhenTheSignerIsBuilt() {
        assertThatThrownBy(() -> registry.get(SignerRegistry.HMAC_SHA256, null))
                .isInstanceOf(InvalidKeyMaterialException.class);
        assertThatThrownBy(() -> registry.get(SignerRegistry.RSA2, KeyMaterial.secret("k")))
                .isInstanceOf(InvalidKeyMaterialException.class);
    }

    @Test
    void digestAlgorithmsRefuseToSignWithoutSecret() {
        assertThatThrownBy(() -> registry.get(SignerRegistry.MD5, KeyMaterial.none()))
                .isInstanceOf(InvalidKeyMaterialException.class);
        assertThatThrownBy(() -> registry.get(SignerRegistry.SHA256, null))
                .isInstanceOf(InvalidKeyMaterialException.class);
    }

    @Test
    void identifiersViewIsReadOnly() {
        assertThatThrownBy(() -> registry.identifiers().add("X")).isInstanceOf(UnsupportedOperationException.class);
    }
}
