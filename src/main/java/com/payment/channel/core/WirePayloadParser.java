package com.payment.channel.core;

import com.payment.channel.api.PayloadFormatException;
import com.payment.channel.domain.ParameterMap;
import com.payment.channel.domain.PaymentChannel;
import com.payment.channel.domain.XmlParameterMap;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decodes provider payloads into field maps in the channel's native format. Values are
 * kept as sent (form empties included) so signature checks see the provider's
 * fields, not a filtered copy.
 */
public final class WirePayloadParser {

    private WirePayloadParser() {}

    public static String decodeUtf8(byte[] raw) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(raw))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new PayloadFormatException("Payload is not valid UTF-8", e);
        }
    }

    public static Map<String, Object> parse(String text, PaymentChannel channel) {
        if (text == null || text.isBlank()) {
            throw new PayloadFormatException("Payload is empty");
        }
        switch (channel.getWireFormat()) {
            case FORM:
                Map<String, String> form = ParameterMap.decodeForm(text.trim());
                if (form.isEmpty()) {
                    throw new PayloadFormatException("Form payload has no fields");
                }
                return new LinkedHashMap<>(form);
            case XML:
                return new LinkedHashMap<>(XmlParameterMap.parse(text).toMap());
            default:
                throw new IllegalStateException("Unhandled wire format " + channel.getWireFormat());
        }
    }
}
