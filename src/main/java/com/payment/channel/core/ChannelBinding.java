package com.payment.channel.core;

import com.payment.channel.api.InvalidKeyMaterialException;
import com.payment.channel.api.PaymentChannelException;
import com.payment.channel.api.SignatureVerificationException;
import com.payment.channel.api.SigningException;
import com.payment.channel.compliance.SensitiveValueMasker;
import com.payment.channel.core.canonical.CanonicalizationProfile;
import com.payment.channel.core.canonical.ChannelProfile;
import com.payment.channel.core.canonical.SecretPlacement;
import com.payment.channel.core.canonical.SigningStringBuilder;
import com.payment.channel.core.signer.Signer;
import com.payment.channel.core.signer.SignerRegistry;
import com.payment.channel.domain.ChannelResponse;
import com.payment.channel.domain.ParameterMap;
import com.payment.channel.domain.ParameterValues;
import com.payment.channel.domain.PaymentChannel;
import com.payment.channel.domain.XmlParameterMap;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A channel configuration joined with its signer. This is the outbound signing surface
 * used by provider clients:
 * <pre>
 * binding.sign(params);                  // adds the signature field
 * String body = binding.serialize(params);
 * </pre>
 * and the synchronous-response check via {@link #verifyResponse(String)}.
 * <p>
 * Immutable and thread-safe. Configuration problems surface in {@link #bind}, never on
 * first use.
 */
@Slf4j
public final class ChannelBinding {

    private final ChannelSettings settings;
    private final Signer signer;
    private final ChannelProfile profile;

    private ChannelBinding(ChannelSettings settings, Signer signer, ChannelProfile profile) {
        this.settings = settings;
        this.signer = signer;
        this.profile = profile;
    }

    /**
     * Resolves the signer for {@code settings} from {@code registry}.
     *
     * @throws com.payment.channel.api.UnsupportedAlgorithmException if the algorithm is unknown
     * @throws InvalidKeyMaterialException if the key material does not fit the algorithm or profile
     */
    public static ChannelBinding bind(ChannelSettings settings, SignerRegistry registry) {
        PaymentChannel channel = settings.getChannel();
        CanonicalizationProfile canonicalization = settings.getEffectiveProfile();
        String secret = settings.getKeyMaterial().getSecret();
        if (canonicalization.getSecretPlacement() == SecretPlacement.APPENDED && !settings.getKeyMaterial().hasSecret()) {
            throw new InvalidKeyMaterialException("Channel " + settings.getName() + " uses " + canonicalization
                    + " which needs a shared secret");
        }

        Signer signer = registry.get(settings.getEffectiveAlgorithm(), settings.getKeyMaterial());
        if (signer.expectsSecretInContent() && canonicalization.getSecretPlacement() != SecretPlacement.APPENDED) {
            throw new InvalidKeyMaterialException("Channel " + settings.getName() + " uses " + signer.getAlgorithm()
                    + ", which takes its secret from the signing string, with " + canonicalization
                    + ", which leaves the secret out");
        }
        ChannelProfile profile = ChannelProfile.builder()
                .canonicalization(canonicalization)
                .signatureField(channel.getSignatureField())
                .excludedFields(channel.getExcludedFields())
                .secret(canonicalization.getSecretPlacement() == SecretPlacement.APPENDED ? secret : null)
                .build();
        log.debug("Bound channel name={} channel={} algorithm={} profile={}",
                settings.getName(), channel, signer.getAlgorithm(), canonicalization);
        return new ChannelBinding(settings, signer, profile);
    }

    public String signingText(Map<String, ?> fields) {
        return SigningStringBuilder.build(fields, profile);
    }

    public String signingText(ParameterMap params) {
        return params.toSigningText(profile);
    }

    /**
     * Signs {@code params} and stores the signature under the channel's signature field.
     * Any previous signature is ignored by the signing string and overwritten.
     *
     * @return the same map, for chaining
     * @throws SigningException if no signature can be produced
     */
    public ParameterMap sign(ParameterMap params) {
        String signature;
        try {
            signature = signer.sign(signingText(params));
        } catch (IllegalArgumentException e) {
            throw new SigningException("Cannot build signing string for " + settings.getName(), e);
        }
        return params.set(profile.getSignatureField(), signature);
    }

    /** Wire encoding of {@code params} for this channel; sign first. */
    public String serialize(ParameterMap params) {
        switch (getChannel().getWireFormat()) {
            case FORM:
                return params.toQueryString();
            case XML:
                return XmlParameterMap.of(params.toMap()).serialize();
            default:
                throw new IllegalStateException("Unhandled wire format " + getChannel().getWireFormat());
        }
    }

    /**
     * Checks {@code signature} against the signing string rebuilt from {@code fields}.
     * The signature field itself, if present in {@code fields}, is ignored.
     */
    public boolean verifySignature(Map<String, ?> fields, String signature) {
        if (signature == null || signature.isBlank()) {
            return false;
        }
        boolean valid = signer.verify(signingText(fields), signature);
        if (!valid) {
            log.warn("Signature mismatch for channel name={} channel={} signature={}",
                    settings.getName(), getChannel(), SensitiveValueMasker.maskSignature(signature));
        }
        return valid;
    }

    /**
     * Verifies a map that still carries its signature field.
     *
     * @throws SignatureVerificationException if the field is missing or the signature does not match
     */
    public void requireValidSignature(Map<String, ?> fields) {
        String signature = ParameterValues.asText(fields.get(profile.getSignatureField()));
        if (signature == null || signature.isBlank()) {
            throw new SignatureVerificationException("Missing signature field '" + profile.getSignatureField() + "'");
        }
        if (!verifySignature(fields, signature)) {
            throw new SignatureVerificationException("Signature verification failed for " + settings.getName());
        }
    }

    /**
     * Parses and verifies a synchronous provider response. Unsigned responses are
     * rejected: a response without a signature cannot be told apart from a forged one.
     */
    public ChannelResponse verifyResponse(String rawBody) {
        try {
            Map<String, Object> fields = WirePayloadParser.parse(rawBody, getChannel());
            requireValidSignature(fields);
            Map<String, Object> data = new LinkedHashMap<>(fields);
            data.remove(profile.getSignatureField());
            return ChannelResponse.success(data, rawBody);
        } catch (PaymentChannelException e) {
            log.warn("Rejected response for channel name={} code={}: {}", settings.getName(), e.getCode(), e.getMessage());
            return ChannelResponse.error(e.getMessage(), e.getCode(), rawBody);
        }
    }

    public String getName() {
        return settings.getName();
    }

    public PaymentChannel getChannel() {
        return settings.getChannel();
    }

    public ChannelSettings getSettings() {
        return settings;
    }

    public Signer getSigner() {
        return signer;
    }

    public ChannelProfile getProfile() {
        return profile;
    }
}
