package io.trading.feed.live;

import io.trading.marketdata.dbn.model.SType;
import io.trading.marketdata.dbn.model.Schema;

import java.util.List;

/**
 * A request for records of one schema for a set of symbols.
 *
 * @param dataset  Dataset code, e.g. "XNAS.ITCH"
 * @param schema   Record schema
 * @param stypeIn  Symbology of {@code symbols}
 * @param symbols  Requested symbols, in request order
 * @param snapshot Whether to request an initial book snapshot
 */
public record Subscription(
    String dataset,
    Schema schema,
    SType stypeIn,
    List<String> symbols,
    boolean snapshot
) {
    /** Symbol requesting every instrument in the dataset. */
    public static final String ALL_SYMBOLS = "ALL_SYMBOLS";

    public Subscription {
        if (dataset == null || dataset.isBlank()) {
            throw new IllegalArgumentException("dataset cannot be null or blank");
        }
        if (schema == null) {
            throw new IllegalArgumentException("schema cannot be null");
        }
        if (stypeIn == null) {
            throw new IllegalArgumentException("stypeIn cannot be null");
        }
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("symbols cannot be null or empty");
        }
        for (String symbol : symbols) {
            validateSymbol(symbol);
        }
        symbols = List.copyOf(symbols);
    }

    private static void validateSymbol(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("symbols cannot contain null or blank entries");
        }
        for (int i = 0; i < symbol.length(); i++) {
            char c = symbol.charAt(i);
            if (Character.isISOControl(c) || c == ',' || c == '|' || c == '=') {
                throw new IllegalArgumentException("Invalid character in symbol: " + symbol);
            }
        }
    }
}
