package com.payment.channel.core.canonical;

/**
 * How the selected fields are joined into one signing string.
 */
public enum JoinStyle {
    /** {@code k1=v1&k2=v2} */
    PAIRS,
    /** {@code v1v2}, for providers that sign concatenated values. */
    VALUES
}
