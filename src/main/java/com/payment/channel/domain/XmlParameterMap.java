package com.payment.channel.domain;

import com.payment.channel.api.PayloadFormatException;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.StringReader;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Flat XML document of text fields, as used by the WeChat family of channels:
 * {@code <xml><appid>wx1</appid><body><![CDATA[A & B]]></body></xml>}.
 * <p>
 * Values with markup characters are written as CDATA. A literal {@code ]]>} is split
 * across two CDATA sections and carriage returns are written as {@code &#13;} so the
 * parser's line-end normalisation cannot alter them; parsing a serialized map always
 * yields an equal map. Values holding characters XML 1.0 forbids (NUL and other control
 * characters, unpaired surrogates) are refused by {@link #serialize(String)}.
 */
public class XmlParameterMap {

    public static final String DEFAULT_ROOT = "xml";

    private static final Pattern ELEMENT_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");
    private static final XMLInputFactory INPUT_FACTORY = createInputFactory();

    private final LinkedHashMap<String, String> values = new LinkedHashMap<>();

    public static XmlParameterMap of(Map<String, ?> source) {
        XmlParameterMap map = new XmlParameterMap();
        if (source != null) {
            source.forEach(map::set);
        }
        return map;
    }

    public XmlParameterMap set(String key, Object value) {
        Objects.requireNonNull(key, "key");
        if (!ParameterValues.isAbsent(value)) {
            values.put(key, ParameterValues.asText(value));
        }
        return this;
    }

    public String get(String key) {
        return values.get(key);
    }

    public String get(String key, String defaultValue) {
        return values.getOrDefault(key, defaultValue);
    }

    public XmlParameterMap remove(String key) {
        values.remove(key);
        return this;
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }

    public Map<String, String> toMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public ParameterMap toParameterMap() {
        return ParameterMap.of(values);
    }

    public String serialize() {
        return serialize(DEFAULT_ROOT);
    }

    public String serialize(String rootTag) {
        requireElementName(rootTag);
        StringBuilder xml = new StringBuilder();
        xml.append('<').append(rootTag).append('>');
        values.forEach((key, value) -> {
            requireElementName(key);
            requireXmlText(key, value);
            xml.append('<').append(key).append('>');
            appendText(xml, value);
            xml.append("</").append(key).append('>');
        });
        xml.append("</").append(rootTag).append('>');
        return xml.toString();
    }

    public static XmlParameterMap parse(String text) {
        return parse(text, DEFAULT_ROOT);
    }

    /**
     * Parses a flat document whose root element is {@code rootTag}. Child elements
     * must contain text only; empty children are skipped like any empty value.
     *
     * @throws PayloadFormatException if the text is not well-formed, the root does not
     *                                match, or a child has nested elements
     */
    public static XmlParameterMap parse(String text, String rootTag) {
        if (text == null || text.isBlank()) {
            throw new PayloadFormatException("XML payload is empty");
        }
        XmlParameterMap map = new XmlParameterMap();
        XMLStreamReader reader = null;
        try {
            reader = INPUT_FACTORY.createXMLStreamReader(new StringReader(text));
            reader.nextTag();
            if (!reader.getLocalName().equals(rootTag)) {
                throw new PayloadFormatException("Expected root <" + rootTag + "> but found <" + reader.getLocalName() + ">");
            }
            while (reader.hasNext()) {
                int event = reader.next();
                if (event == XMLStreamConstants.START_ELEMENT) {
                    String key = reader.getLocalName();
                    // getElementText rejects nested elements
                    map.set(key, reader.getElementText());
                } else if (event == XMLStreamConstants.CHARACTERS && !reader.isWhiteSpace()) {
                    throw new PayloadFormatException("Unexpected text directly under <" + rootTag + ">");
                } else if (event == XMLStreamConstants.END_ELEMENT) {
                    break;
                }
            }
            // drain so trailing garbage after the root is reported as malformed
            while (reader.hasNext()) {
                reader.next();
            }
            return map;
        } catch (XMLStreamException e) {
            throw new PayloadFormatException("Malformed XML payload: " + e.getMessage(), e);
        } finally {
            closeQuietly(reader);
        }
    }

    private static void appendText(StringBuilder xml, String value) {
        if (!needsCdata(value)) {
            xml.append(value.replace("\r", "&#13;"));
            return;
        }
        xml.append("<![CDATA[");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '\r') {
                xml.append("]]>&#13;<![CDATA[");
            } else if (c == '>' && i >= 2 && value.charAt(i - 1) == ']' && value.charAt(i - 2) == ']') {
                xml.append("]]><![CDATA[>");
            } else {
                xml.append(c);
            }
        }
        xml.append("]]>");
    }

    private static boolean needsCdata(String value) {
        for (int i = 0; i < value.length(); i++) {
            switch (value.charAt(i)) {
                case '<':
                case '>':
                case '&':
                case '\'':
                case '"':
                    return true;
                default:
                    break;
            }
        }
        return false;
    }

    /** XML 1.0 {@code Char} production; anything else cannot be written, even as a reference. */
    private static void requireXmlText(String key, String value) {
        value.codePoints().forEach(c -> {
            boolean allowed = c == 0x9 || c == 0xA || c == 0xD
                    || (c >= 0x20 && c <= 0xD7FF)
                    || (c >= 0xE000 && c <= 0xFFFD)
                    || (c >= 0x10000 && c <= 0x10FFFF);
            if (!allowed) {
                throw new IllegalArgumentException(String.format(
                        "Value of <%s> contains U+%04X, which XML 1.0 cannot represent", key, c));
            }
        });
    }

    private static void requireElementName(String name) {
        if (name == null || !ELEMENT_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a valid XML element name: " + name);
        }
    }

    private static XMLInputFactory createInputFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        factory.setProperty(XMLInputFactory.IS_COALESCING, true);
        return factory;
    }

    private static void closeQuietly(XMLStreamReader reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.close();
        } catch (XMLStreamException ignored) {
            // reader over an in-memory string; nothing to release
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof XmlParameterMap)) return false;
        return values.equals(((XmlParameterMap) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "XmlParameterMap" + values;
    }
}
