package io.trading.marketdata.dbn.model;

/**
 * Subsampled best bid and offer with the last trade in the interval.
 */
public record BboMsg(
    RecordHeader header,
    long price,
    long size,
    char side,
    int flags,
    long tsRecv,
    long sequence,
    BidAskPair level
) implements Record {
    public BboMsg {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
    }
}
