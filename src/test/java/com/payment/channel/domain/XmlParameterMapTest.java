package com.payment.channel.domain;

import com.payment.channel.api.PayloadFormatException;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class XmlParameterMapTest {

    @Test
    void serializesPlainValuesAsTextAndMarkupAsCdata() {
        XmlParameterMap xml = new XmlParameterMap()
                .set("appid", "wx1")
                .set("body", "A & B")
                .set("attach", null);

        assertThat(xml.serialize()).isEqualTo("<xml><appid>wx1</appid><body><![CDATA[A & B]]></body></xml>");
    }

    @Test
    void serializeHonoursCustomRoot() {
        assertThat(new XmlParameterMap().set("a", 1).serialize("request"))
                .isEqualTo("<request><a>1</a></request>");
    }

    @Test
    void parseOfSerializedDocumentYieldsEqualMap() {
        Map<String, String> source = new LinkedHashMap<>();
        source.put("plain", "wx1");
        source.put("markup", "<b>bold</b> & 'quoted' \"double\"");
        source.put("terminator", "x]]>y]]>");
        source.put("lines", "line1\r\nline2\rline3");
        source.put("cdataLines", "<a>\r\n</a>");
        source.put("unicode", "咖啡 ☕");

        String serialized = XmlParameterMap.of(source).serialize();
        XmlParameterMap parsed = XmlParameterMap.parse(serialized);

        assertThat(parsed.toMap()).containsExactlyEntriesOf(source);
    }

    @Test
    void parseReadsProviderNotification() {
        XmlParameterMap parsed = XmlParameterMap.parse(
                "<xml>\n  <return_code><![CDATA[SUCCESS]]></return_code>\n  <total_fee>1</total_fee>\n  <attach></attach>\n</xml>");

        assertThat(parsed.get("return_code")).isEqualTo("SUCCESS");
        assertThat(parsed.get("total_fee")).isEqualTo("1");
        assertThat(parsed.contains("attach")).isFalse();
        assertThat(parsed.get("missing", "none")).isEqualTo("none");
    }

    @Test
    void parseRejectsUnexpectedRoot() {
        assertThatThrownBy(() -> XmlParameterMap.parse("<root><a>1</a></root>"))
                .isInstanceOf(PayloadFormatException.class)
                .hasMessageContaining("root");
    }

    @Test
    void parseAcceptsExplicitRoot() {
        assertThat(XmlParameterMap.parse("<root><a>1</a></root>", "root").get("a")).isEqualTo("1");
    }

    @Test
    void parseRejectsMalformedDocuments() {
        assertThatThrownBy(() -> XmlParameterMap.parse("<xml><a>1</xml>")).isInstanceOf(PayloadFormatException.class);
        assertThatThrownBy(() -> XmlParameterMap.parse("not xml")).isInstanceOf(PayloadFormatException.class);
        assertThatThrownBy(() -> XmlParameterMap.parse("")).isInstanceOf(PayloadFormatException.class);
    }

    @Test
    void parseRejectsNestedElements() {
        assertThatThrownBy(() -> XmlParameterMap.parse("<xml><a><b>1</b></a></xml>"))
                .isInstanceOf(PayloadFormatException.class);
    }

    @Test
    void parseRejectsTextDirectlyUnderRoot() {
        assertThatThrownBy(() -> XmlParameterMap.parse("<xml>stray<a>1</a></xml>"))
                .isInstanceOf(PayloadFormatException.class);
    }

    @Test
    void serializeRejectsInvalidElementNames() {
        XmlParameterMap xml = new XmlParameterMap().set("1bad", "x");

        assertThatThrownBy(xml::serialize).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void serializeRejectsCharactersXmlCannotCarry() {
        XmlParameterMap control = new XmlParameterMap().set("attach", "x\u0001y");
        XmlParameterMap nonCharacter = new XmlParameterMap().set("attach", "x\uFFFEy");

        assertThatThrownBy(control::serialize)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("U+0001");
        assertThatThrownBy(nonCharacter::serialize).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tabsAndLineBreaksSurviveSerialization() {
        XmlParameterMap original = new XmlParameterMap().set("attach", "a\tb\nc");

        XmlParameterMap parsed = XmlParameterMap.parse(original.serialize());

        assertThat(parsed.get("attach")).isEqualTo("a\tb\nc");
    }

    @Test
    void toParameterMapKeepsOrder() {
        ParameterMap params = new XmlParameterMap().set("b", "2").set("a", "1").toParameterMap();

        assertThat(params.keys()).containsExactly("b", "a");
    }
}
