package io.trading.marketdata.dbn.model;

/**
 * Consolidated best bid and offer across venues. Also used for TCBBO.
 */
public record CbboMsg(
    RecordHeader header,
    long price,
    long size,
    char side,
    int flags,
    long tsRecv,
    ConsolidatedBidAskPair level
) implements Record {
    public CbboMsg {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
    }
}
