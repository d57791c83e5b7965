package io.trading.marketdata.dbn.codec;

import org.agrona.DirectBuffer;
import org.agrona.MutableDirectBuffer;

import java.nio.charset.StandardCharsets;

/**
 * Fixed-width, NUL-terminated string fields.
 */
public final class CStrings {

    private CStrings() {}

    /**
     * Index of the first NUL byte within {@code [offset, offset + width)}, relative to
     * {@code offset}, or -1 when the field is not terminated.
     */
    public static int terminatorIndex(DirectBuffer buffer, int offset, int width) {
        for (int i = 0; i < width; i++) {
            if (buffer.getByte(offset + i) == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Reads {@code length} bytes as a UTF-8 string.
     */
    public static String decode(DirectBuffer buffer, int offset, int length) {
        if (length == 0) {
            return "";
        }
        byte[] bytes = new byte[length];
        buffer.getBytes(offset, bytes);
        return new String(bytes, StandardCharsets.UTF_8);
    }

    /**
     * Writes {@code value} into a field of {@code width} bytes, zero-filling the remainder.
     * The value must leave room for the terminator.
     */
    public static void write(MutableDirectBuffer buffer, int offset, int width, String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        if (bytes.length >= width) {
            throw new IllegalArgumentException(
                "String of " + bytes.length + " bytes does not fit a " + width + "-byte field: " + value);
        }
        buffer.putBytes(offset, bytes);
        buffer.setMemory(offset + bytes.length, width - bytes.length, (byte) 0);
    }
}
