package io.trading.marketdata.dbn.model;

/**
 * Consolidated market-by-price event with the top book level.
 */
public record Cmbp1Msg(
    RecordHeader header,
    long price,
    long size,
    char action,
    char side,
    int flags,
    long tsRecv,
    int tsInDelta,
    ConsolidatedBidAskPair level
) implements Record {
    public Cmbp1Msg {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
    }
}
