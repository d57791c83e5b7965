package io.trading.marketdata.dbn.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Trade record (market by price, zero depth).
 */
public record TradeMsg(
    RecordHeader header,
    long price,
    long size,
    char action,
    char side,
    int flags,
    int depth,
    long tsRecv,
    int tsInDelta,
    long sequence
) implements Record {
    public TradeMsg {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
    }

    public Optional<BigDecimal> priceDecimal() {
        return FixedPrice.toDecimal(price);
    }

    public Side sideEnum() {
        return Side.fromCode(side);
    }
}
