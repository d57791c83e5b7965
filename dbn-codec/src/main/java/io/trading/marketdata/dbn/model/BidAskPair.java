package io.trading.marketdata.dbn.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * One aggregated book level: best prices, sizes and order counts on each side.
 */
public record BidAskPair(
    long bidPx,
    long askPx,
    long bidSz,
    long askSz,
    long bidCt,
    long askCt
) {
    /** Wire size of one level. */
    public static final int SIZE = 32;

    /** A level with undefined prices and zero sizes. */
    public static final BidAskPair EMPTY = new BidAskPair(
        FixedPrice.UNDEF_PRICE, FixedPrice.UNDEF_PRICE, 0, 0, 0, 0);

    public Optional<BigDecimal> bidPrice() {
        return FixedPrice.toDecimal(bidPx);
    }

    public Optional<BigDecimal> askPrice() {
        return FixedPrice.toDecimal(askPx);
    }
}
