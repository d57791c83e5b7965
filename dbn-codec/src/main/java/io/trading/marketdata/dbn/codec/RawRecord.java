package io.trading.marketdata.dbn.codec;

import io.trading.marketdata.dbn.error.DecodeException;
import org.agrona.DirectBuffer;
import org.agrona.concurrent.UnsafeBuffer;

/**
 * Undecoded record bytes as handed out by a producer: a region of a buffer plus the
 * record type tag.
 *
 * <p>A raw record delivered to a callback aliases the producer's buffer and is only valid
 * until the callback returns. Use {@link #copy()} before handing it to another thread.
 */
public final class RawRecord {

    private final DirectBuffer buffer;
    private final int offset;
    private final int length;
    private final int rtype;
    private final boolean detached;

    public RawRecord(DirectBuffer buffer, int offset, int length, int rtype) {
        this(buffer, offset, length, rtype, false);
    }

    private RawRecord(DirectBuffer buffer, int offset, int length, int rtype, boolean detached) {
        if (buffer == null) {
            throw new IllegalArgumentException("buffer cannot be null");
        }
        if (offset < 0 || length < 0 || offset > buffer.capacity() - length) {
            throw new IllegalArgumentException(
                "region [" + offset + ", " + length + "] out of bounds for capacity " + buffer.capacity());
        }
        if (rtype < 0 || rtype > 0xFF) {
            throw new IllegalArgumentException("rtype out of range: " + rtype);
        }
        this.buffer = buffer;
        this.offset = offset;
        this.length = length;
        this.rtype = rtype;
        this.detached = detached;
    }

    /**
     * Wraps a region whose rtype is read from the record header.
     */
    public static RawRecord wrap(DirectBuffer buffer, int offset, int length) {
        if (length < 2) {
            throw new DecodeException("Record of " + length + " bytes has no rtype", -1, length);
        }
        return new RawRecord(buffer, offset, length, buffer.getByte(offset + 1) & 0xFF);
    }

    /**
     * Creates a detached raw record owning a copy of {@code bytes}.
     */
    public static RawRecord of(byte[] bytes, int rtype) {
        return new RawRecord(new UnsafeBuffer(bytes.clone()), 0, bytes.length, rtype, true);
    }

    public DirectBuffer buffer() {
        return buffer;
    }

    public int offset() {
        return offset;
    }

    public int length() {
        return length;
    }

    public int rtype() {
        return rtype;
    }

    /**
     * True when this instance owns its bytes and may outlive the producer callback.
     */
    public boolean isDetached() {
        return detached;
    }

    /**
     * Returns a detached instance holding its own copy of the bytes.
     */
    public RawRecord copy() {
        return new RawRecord(new UnsafeBuffer(toByteArray()), 0, length, rtype, true);
    }

    public byte[] toByteArray() {
        byte[] bytes = new byte[length];
        buffer.getBytes(offset, bytes);
        return bytes;
    }

    @Override
    public String toString() {
        return "RawRecord[rtype=0x" + Integer.toHexString(rtype) + ", length=" + length
            + ", detached=" + detached + "]";
    }
}
