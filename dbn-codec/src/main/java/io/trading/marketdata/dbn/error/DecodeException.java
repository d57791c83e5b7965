package io.trading.marketdata.dbn.error;

/**
 * Raised when a single record cannot be decoded: the buffer is shorter than the
 * fixed size of its record type, or a fixed-width string field is not terminated.
 * The failure is local to one record.
 */
public class DecodeException extends FeedException {

    private final int rtype;
    private final int length;

    public DecodeException(String message, int rtype, int length) {
        super(message);
        this.rtype = rtype;
        this.length = length;
    }

    public DecodeException(String message, int rtype, int length, Throwable cause) {
        super(message, cause);
        this.rtype = rtype;
        this.length = length;
    }

    /**
     * The record type tag that was being decoded, or -1 when unknown.
     */
    public int getRtype() {
        return rtype;
    }

    /**
     * The number of bytes that were available.
     */
    public int getLength() {
        return length;
    }
}
