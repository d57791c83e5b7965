package io.trading.marketdata.dbn.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Symbology types.
 */
public enum SType {
    INSTRUMENT_ID(0, "instrument_id"),
    RAW_SYMBOL(1, "raw_symbol"),
    SMART(2, "smart"),
    CONTINUOUS(3, "continuous"),
    PARENT(4, "parent"),
    NASDAQ_SYMBOL(5, "nasdaq_symbol"),
    CMS_SYMBOL(6, "cms_symbol"),
    ISIN(7, "isin"),
    US_CODE(8, "us_code"),
    BBG_COMP_ID(9, "bbg_comp_id"),
    BBG_COMP_TICKER(10, "bbg_comp_ticker"),
    FIGI(11, "figi"),
    FIGI_TICKER(12, "figi_ticker");

    /** Wire code meaning the input symbology is mixed. */
    public static final int MIXED_CODE = 0xFF;

    private final int code;
    private final String stypeName;

    SType(int code, String stypeName) {
        this.code = code;
        this.stypeName = stypeName;
    }

    public int code() {
        return code;
    }

    @JsonValue
    public String stypeName() {
        return stypeName;
    }

    /**
     * Looks up a symbology type by wire code. Returns null for {@link #MIXED_CODE}.
     *
     * @throws IllegalArgumentException if the code is not a known symbology type
     */
    public static SType fromCode(int code) {
        if (code == MIXED_CODE) {
            return null;
        }
        for (SType stype : values()) {
            if (stype.code == code) {
                return stype;
            }
        }
        throw new IllegalArgumentException("Unknown stype code: " + code);
    }

    @JsonCreator
    public static SType fromName(String name) {
        for (SType stype : values()) {
            if (stype.stypeName.equals(name)) {
                return stype;
            }
        }
        throw new IllegalArgumentException("Unknown stype: " + name);
    }

    @Override
    public String toString() {
        return stypeName;
    }
}
