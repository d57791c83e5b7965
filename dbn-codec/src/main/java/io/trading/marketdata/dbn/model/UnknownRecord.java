package io.trading.marketdata.dbn.model;

import java.util.Arrays;
import java.util.HexFormat;

/**
 * A record whose tag this client does not recognize. Holds a private copy of the raw bytes
 * so it can be passed through or re-encoded unchanged.
 */
public record UnknownRecord(RecordHeader header, byte[] rawBytes) implements Record {

    public UnknownRecord {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
        if (rawBytes == null || rawBytes.length < RType.HEADER_SIZE) {
            throw new IllegalArgumentException("rawBytes must hold at least the record header");
        }
        rawBytes = rawBytes.clone();
    }

    @Override
    public byte[] rawBytes() {
        return rawBytes.clone();
    }

    public int byteLength() {
        return rawBytes.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof UnknownRecord other)) {
            return false;
        }
        return header.equals(other.header) && Arrays.equals(rawBytes, other.rawBytes);
    }

    @Override
    public int hashCode() {
        return 31 * header.hashCode() + Arrays.hashCode(rawBytes);
    }

    @Override
    public String toString() {
        return "UnknownRecord[header=" + header + ", rawBytes=" + HexFormat.of().formatHex(rawBytes) + "]";
    }
}
