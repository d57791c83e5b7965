package io.trading.marketdata.dbn.model;

/**
 * One-byte record type tags and the fixed wire size of each record variant.
 */
public enum RType {
    MBP_0(0x00, 48),
    MBP_1(0x01, 80),
    MBP_10(0x02, 368),
    OHLCV_1S(0x12, 56),
    OHLCV_1M(0x13, 56),
    OHLCV_1H(0x14, 56),
    OHLCV_1D(0x15, 56),
    OHLCV_EOD(0x16, 56),
    STATUS(0x17, 40),
    INSTRUMENT_DEF(0x18, 520),
    IMBALANCE(0x19, 112),
    ERROR(0x1A, 320),
    SYMBOL_MAPPING(0x1B, 176),
    SYSTEM(0x1C, 320),
    STATISTICS(0x1D, 80),
    MBO(0xA0, 56),
    CMBP_1(0xB1, 80),
    CBBO_1S(0xB2, 80),
    CBBO_1M(0xB3, 80),
    TCBBO(0xB4, 80),
    BBO_1S(0xC2, 80),
    BBO_1M(0xC3, 80);

    /** Size of the common record header in bytes. */
    public static final int HEADER_SIZE = 16;

    /** Record lengths are stored in units of this many bytes. */
    public static final int LENGTH_MULTIPLIER = 4;

    /** Largest record length a one-byte length field can express. */
    public static final int MAX_RECORD_SIZE = 0xFF * LENGTH_MULTIPLIER;

    private static final RType[] BY_CODE = new RType[256];

    static {
        for (RType type : values()) {
            BY_CODE[type.code] = type;
        }
    }

    private final int code;
    private final int size;

    RType(int code, int size) {
        this.code = code;
        this.size = size;
    }

    public int code() {
        return code;
    }

    /**
     * Fixed wire size of records carrying this tag.
     */
    public int size() {
        return size;
    }

    /**
     * Looks up a tag, returning null for tags this client does not know.
     */
    public static RType fromCode(int code) {
        return BY_CODE[code & 0xFF];
    }

    /**
     * Minimum number of bytes a record with the given tag must have.
     * Unknown tags only need the common header.
     */
    public static int minimumSize(int code) {
        RType type = fromCode(code);
        return type == null ? HEADER_SIZE : type.size;
    }

    public boolean isOhlcv() {
        return code >= OHLCV_1S.code && code <= OHLCV_EOD.code;
    }
}
