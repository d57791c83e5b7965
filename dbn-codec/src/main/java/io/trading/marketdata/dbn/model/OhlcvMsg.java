package io.trading.marketdata.dbn.model;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Open, high, low, close and volume bar. The bar interval is given by the rtype.
 */
public record OhlcvMsg(
    RecordHeader header,
    long open,
    long high,
    long low,
    long close,
    long volume
) implements Record {
    public OhlcvMsg {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
    }

    public Optional<BigDecimal> openDecimal() {
        return FixedPrice.toDecimal(open);
    }

    public Optional<BigDecimal> closeDecimal() {
        return FixedPrice.toDecimal(close);
    }
}
