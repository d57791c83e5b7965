package io.trading.marketdata.dbn.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Data record schemas, with their wire codes and canonical names.
 */
public enum Schema {
    MBO(0, "mbo"),
    MBP_1(1, "mbp-1"),
    MBP_10(2, "mbp-10"),
    TBBO(3, "tbbo"),
    TRADES(4, "trades"),
    OHLCV_1S(5, "ohlcv-1s"),
    OHLCV_1M(6, "ohlcv-1m"),
    OHLCV_1H(7, "ohlcv-1h"),
    OHLCV_1D(8, "ohlcv-1d"),
    DEFINITION(9, "definition"),
    STATISTICS(10, "statistics"),
    STATUS(11, "status"),
    IMBALANCE(12, "imbalance"),
    OHLCV_EOD(13, "ohlcv-eod"),
    CMBP_1(14, "cmbp-1"),
    CBBO_1S(15, "cbbo-1s"),
    CBBO_1M(16, "cbbo-1m"),
    TCBBO(17, "tcbbo"),
    BBO_1S(18, "bbo-1s"),
    BBO_1M(19, "bbo-1m");

    /** Wire code meaning the data contains several schemas. */
    public static final int MIXED_CODE = 0xFFFF;

    private final int code;
    private final String schemaName;

    Schema(int code, String schemaName) {
        this.code = code;
        this.schemaName = schemaName;
    }

    public int code() {
        return code;
    }

    @JsonValue
    public String schemaName() {
        return schemaName;
    }

    /**
     * Looks up a schema by wire code. Returns null for {@link #MIXED_CODE}.
     *
     * @throws IllegalArgumentException if the code is not a known schema
     */
    public static Schema fromCode(int code) {
        if (code == MIXED_CODE) {
            return null;
        }
        for (Schema schema : values()) {
            if (schema.code == code) {
                return schema;
            }
        }
        throw new IllegalArgumentException("Unknown schema code: " + code);
    }

    /**
     * Looks up a schema by its canonical name, e.g. {@code "mbp-1"}.
     *
     * @throws IllegalArgumentException if the name is not a known schema
     */
    @JsonCreator
    public static Schema fromName(String name) {
        for (Schema schema : values()) {
            if (schema.schemaName.equals(name)) {
                return schema;
            }
        }
        throw new IllegalArgumentException("Unknown schema: " + name);
    }

    @Override
    public String toString() {
        return schemaName;
    }
}
