package com.payment.channel.domain;

/**
 * Native encoding a channel uses for requests, responses and notifications.
 */
public enum WireFormat {
    /** {@code application/x-www-form-urlencoded} key/value pairs. */
    FORM,
    /** Flat XML document, see {@link XmlParameterMap}. */
    XML
}
