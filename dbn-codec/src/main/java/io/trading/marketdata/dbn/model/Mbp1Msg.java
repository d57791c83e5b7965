package io.trading.marketdata.dbn.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Market-by-price event with the top book level. Also used for TBBO.
 */
public record Mbp1Msg(
    RecordHeader header,
    long price,
    long size,
    char action,
    char side,
    int flags,
    int depth,
    long tsRecv,
    int tsInDelta,
    long sequence,
    BidAskPair level
) implements Record {
    public Mbp1Msg {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
    }

    public Optional<BigDecimal> priceDecimal() {
        return FixedPrice.toDecimal(price);
    }
}
