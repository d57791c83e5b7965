package io.trading.marketdata.dbn.model;

/**
 * Maps the instrument id in the header to a symbol for the interval
 * [{@code startTs}, {@code endTs}).
 */
public record SymbolMappingMsg(
    RecordHeader header,
    int stypeIn,
    String stypeInSymbol,
    int stypeOut,
    String stypeOutSymbol,
    long startTs,
    long endTs
) implements Record {
    public SymbolMappingMsg {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
        if (stypeInSymbol == null || stypeOutSymbol == null) {
            throw new IllegalArgumentException("symbols cannot be null");
        }
    }
}
