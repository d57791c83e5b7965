package io.trading.marketdata.dbn.metadata;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The symbols a requested raw symbol resolved to over time.
 *
 * @param rawSymbol the symbol as requested, in the input symbology
 * @param intervals resolved symbols in date order
 */
public record SymbolMapping(
    @JsonProperty("raw_symbol") String rawSymbol,
    @JsonProperty("intervals") List<MappingInterval> intervals
) {
    public SymbolMapping {
        if (rawSymbol == null) {
            throw new IllegalArgumentException("rawSymbol cannot be null");
        }
        if (intervals == null) {
            throw new IllegalArgumentException("intervals cannot be null");
        }
        intervals = List.copyOf(intervals);
    }
}
