package io.trading.feed.config;

import java.util.Locale;

/**
 * How a live session reacts to a record that fails to decode.
 */
public enum DecodeMode {
    /** Terminate the record stream with the decode error. */
    STRICT,
    /** Log and count the error, skip the record and keep streaming. */
    LENIENT;

    public static DecodeMode fromString(String value) {
        return DecodeMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
