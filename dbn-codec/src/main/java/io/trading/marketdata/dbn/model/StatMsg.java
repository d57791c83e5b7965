package io.trading.marketdata.dbn.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Published statistic such as an opening price, settlement or open interest.
 */
public record StatMsg(
    RecordHeader header,
    long tsRecv,
    long tsRef,
    long price,
    long quantity,
    long sequence,
    int tsInDelta,
    int statType,
    int channelId,
    int updateAction,
    int statFlags
) implements Record {

    /** Sentinel for an undefined statistic quantity. */
    public static final long UNDEF_STAT_QUANTITY = Long.MAX_VALUE;

    public StatMsg {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
    }

    public Optional<BigDecimal> priceDecimal() {
        return FixedPrice.toDecimal(price);
    }

    public boolean hasQuantity() {
        return quantity != UNDEF_STAT_QUANTITY;
    }
}
