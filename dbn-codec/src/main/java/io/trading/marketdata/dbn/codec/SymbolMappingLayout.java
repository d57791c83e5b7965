package io.trading.marketdata.dbn.codec;

/**
 * Symbol field width of the symbol mapping record.
 */
final class SymbolMappingLayout {

    static final int SYMBOL_WIDTH = 71;

    private SymbolMappingLayout() {}
}
