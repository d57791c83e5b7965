package io.trading.marketdata.dbn.codec;

/**
 * Field offsets within the 520-byte instrument definition record.
 */
final class InstrumentDefLayout {

    static final int TS_RECV = 16;
    static final int MIN_PRICE_INCREMENT = 24;
    static final int DISPLAY_FACTOR = 32;
    static final int EXPIRATION = 40;
    static final int ACTIVATION = 48;
    static final int HIGH_LIMIT_PRICE = 56;
    static final int LOW_LIMIT_PRICE = 64;
    static final int MAX_PRICE_VARIATION = 72;
    static final int TRADING_REFERENCE_PRICE = 80;

    static final int CURRENCY = 178;
    static final int SETTL_CURRENCY = 183;
    static final int SECSUBTYPE = 188;
    static final int RAW_SYMBOL = 194;
    static final int GROUP = 216;
    static final int EXCHANGE = 237;
    static final int ASSET = 242;
    static final int CFI = 249;
    static final int SECURITY_TYPE = 256;
    static final int UNIT_OF_MEASURE = 263;
    static final int UNDERLYING = 294;

    static final int INSTRUMENT_CLASS = 319;
    static final int STRIKE_PRICE = 320;
    static final int MATCH_ALGORITHM = 328;

    static final int CURRENCY_WIDTH = 5;
    static final int SECSUBTYPE_WIDTH = 6;
    static final int RAW_SYMBOL_WIDTH = 22;
    static final int GROUP_WIDTH = 21;
    static final int EXCHANGE_WIDTH = 5;
    static final int ASSET_WIDTH = 7;
    static final int CFI_WIDTH = 7;
    static final int SECURITY_TYPE_WIDTH = 7;
    static final int UNIT_OF_MEASURE_WIDTH = 31;
    static final int UNDERLYING_WIDTH = 21;

    private InstrumentDefLayout() {}
}
