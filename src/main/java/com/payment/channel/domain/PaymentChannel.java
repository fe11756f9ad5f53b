package com.payment.channel.domain;

import com.payment.channel.core.canonical.CanonicalizationProfile;

import java.util.Set;

/**
 * Supported payment channels and the protocol conventions that differ between them:
 * wire format, signature field, extra fields left out of the signing string, default
 * signing setup, and the exact acknowledgement bodies a notification receiver must
 * return. Providers pattern-match acknowledgements, so the bodies are byte-exact.
 */
public enum PaymentChannel {

    ALIPAY(WireFormat.FORM, "sign", Set.of(), "RSA2", CanonicalizationProfile.ASYMMETRIC,
            "success", "failure"),

    WECHAT(WireFormat.XML, "sign", Set.of(), "MD5", CanonicalizationProfile.KEYED_DIGEST,
            Acknowledgements.XML_SUCCESS, Acknowledgements.XML_FAILURE),

    /** QQ Wallet mirrors the WeChat v2 protocol. */
    QQ(WireFormat.XML, "sign", Set.of(), "MD5", CanonicalizationProfile.KEYED_DIGEST,
            Acknowledgements.XML_SUCCESS, Acknowledgements.XML_FAILURE);

    private final WireFormat wireFormat;
    private final String signatureField;
    private final Set<String> excludedFields;
    private final String defaultAlgorithm;
    private final CanonicalizationProfile defaultProfile;
    private final String successAcknowledgement;
    private final String failureAcknowledgement;

    PaymentChannel(WireFormat wireFormat, String signatureField, Set<String> excludedFields,
                   String defaultAlgorithm, CanonicalizationProfile defaultProfile,
                   String successAcknowledgement, String failureAcknowledgement) {
        this.wireFormat = wireFormat;
        this.signatureField = signatureField;
        this.excludedFields = excludedFields;
        this.defaultAlgorithm = defaultAlgorithm;
        this.defaultProfile = defaultProfile;
        this.successAcknowledgement = successAcknowledgement;
        this.failureAcknowledgement = failureAcknowledgement;
    }

    public WireFormat getWireFormat() {
        return wireFormat;
    }

    public String getSignatureField() {
        return signatureField;
    }

    /** Channel-specific fields never signed, in addition to the signature field. */
    public Set<String> getExcludedFields() {
        return excludedFields;
    }

    public String getDefaultAlgorithm() {
        return defaultAlgorithm;
    }

    public CanonicalizationProfile getDefaultProfile() {
        return defaultProfile;
    }

    public String acknowledge(boolean success) {
        return success ? successAcknowledgement : failureAcknowledgement;
    }

    private static final class Acknowledgements {
        static final String XML_SUCCESS = "<xml><return_code>SUCCESS</return_code><return_msg>OK</return_msg></xml>";
        static final String XML_FAILURE = "<xml><return_code>FAIL</return_code><return_msg>FAIL</return_msg></xml>";
    }
}
