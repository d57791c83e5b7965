package io.trading.marketdata.dbn.model;

/**
 * Bit flags carried in the {@code flags} field of book and trade records.
 */
public final class RecordFlags {

    /** Last record in the event for this instrument. */
    public static final int LAST = 1 << 7;
    /** Top-of-book message, not an individual order. */
    public static final int TOB = 1 << 6;
    /** Sourced from a replay such as a snapshot server. */
    public static final int SNAPSHOT = 1 << 5;
    /** Aggregated price level message, not an individual order. */
    public static final int MBP = 1 << 4;
    /** The ts_recv value is inaccurate. */
    public static final int BAD_TS_RECV = 1 << 3;
    /** An unrecoverable gap was detected in the channel. */
    public static final int MAYBE_BAD_BOOK = 1 << 2;

    private RecordFlags() {}

    public static boolean isSet(int flags, int flag) {
        return (flags & flag) != 0;
    }

    public static boolean isLast(int flags) {
        return isSet(flags, LAST);
    }

    public static boolean isSnapshot(int flags) {
        return isSet(flags, SNAPSHOT);
    }
}
