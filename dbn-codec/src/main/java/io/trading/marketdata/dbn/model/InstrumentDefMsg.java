package io.trading.marketdata.dbn.model;

/**
 * Instrument definition. Only the commonly used subset of the definition is exposed;
 * the remaining fields of the 520-byte layout are skipped on decode and zeroed on encode.
 */
public record InstrumentDefMsg(
    RecordHeader header,
    long tsRecv,
    long minPriceIncrement,
    long displayFactor,
    long expiration,
    long activation,
    long highLimitPrice,
    long lowLimitPrice,
    long maxPriceVariation,
    long tradingReferencePrice,
    String currency,
    String settlCurrency,
    String secSubType,
    String rawSymbol,
    String group,
    String exchange,
    String asset,
    String cfi,
    String securityType,
    String unitOfMeasure,
    String underlying,
    char instrumentClass,
    long strikePrice,
    char matchAlgorithm
) implements Record {
    public InstrumentDefMsg {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
        if (currency == null || settlCurrency == null || secSubType == null || rawSymbol == null
            || group == null || exchange == null || asset == null || cfi == null
            || securityType == null || unitOfMeasure == null || underlying == null) {
            throw new IllegalArgumentException("string fields cannot be null");
        }
    }
}
