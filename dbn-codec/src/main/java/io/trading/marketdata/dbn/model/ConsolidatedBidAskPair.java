package io.trading.marketdata.dbn.model;

/**
 * One consolidated book level across venues, with the publisher of each best price.
 */
public record ConsolidatedBidAskPair(
    long bidPx,
    long askPx,
    long bidSz,
    long askSz,
    int bidPb,
    int askPb
) {
    /** Wire size of one level. */
    public static final int SIZE = 32;
}
