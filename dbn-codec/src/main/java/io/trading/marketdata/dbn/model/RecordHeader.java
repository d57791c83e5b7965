package io.trading.marketdata.dbn.model;

/**
 * Common 16-byte header carried by every DBN record.
 *
 * @param length       record length in 4-byte units, as found on the wire
 * @param rtype        record type tag
 * @param publisherId  publisher (dataset and venue) identifier
 * @param instrumentId numeric instrument identifier (unsigned 32-bit)
 * @param tsEvent      matching-engine event timestamp, nanoseconds since the Unix epoch
 */
public record RecordHeader(
    int length,
    int rtype,
    int publisherId,
    long instrumentId,
    long tsEvent
) {
    public RecordHeader {
        if (length < 0 || length > 0xFF) {
            throw new IllegalArgumentException("length out of range: " + length);
        }
        if (rtype < 0 || rtype > 0xFF) {
            throw new IllegalArgumentException("rtype out of range: " + rtype);
        }
        if (publisherId < 0 || publisherId > 0xFFFF) {
            throw new IllegalArgumentException("publisherId out of range: " + publisherId);
        }
        if (instrumentId < 0 || instrumentId > 0xFFFF_FFFFL) {
            throw new IllegalArgumentException("instrumentId out of range: " + instrumentId);
        }
    }

    /**
     * Creates a header for a known record type, deriving the length from its fixed size.
     */
    public static RecordHeader of(RType rtype, int publisherId, long instrumentId, long tsEvent) {
        return new RecordHeader(rtype.size() / RType.LENGTH_MULTIPLIER, rtype.code(),
            publisherId, instrumentId, tsEvent);
    }

    /**
     * Record size in bytes.
     */
    public int recordSize() {
        return length * RType.LENGTH_MULTIPLIER;
    }
}
