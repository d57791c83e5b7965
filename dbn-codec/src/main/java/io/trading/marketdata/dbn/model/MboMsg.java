package io.trading.marketdata.dbn.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Market-by-order event: one order added, modified, cancelled or filled.
 */
public record MboMsg(
    RecordHeader header,
    long orderId,
    long price,
    long size,
    int flags,
    int channelId,
    char action,
    char side,
    long tsRecv,
    int tsInDelta,
    long sequence
) implements Record {
    public MboMsg {
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

    public Action actionEnum() {
        return Action.fromCode(action);
    }
}
