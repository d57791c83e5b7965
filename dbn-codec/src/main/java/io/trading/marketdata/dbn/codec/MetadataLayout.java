package io.trading.marketdata.dbn.codec;

/**
 * Offsets of the DBN metadata header. Offsets after the prelude are relative to the
 * start of the header body.
 */
final class MetadataLayout {

    static final byte[] MAGIC = {'D', 'B', 'N'};

    /** Magic, version byte and u32 body length. */
    static final int PRELUDE_SIZE = 8;

    static final int DATASET = 0;
    static final int SCHEMA = 16;
    static final int START = 18;
    static final int END = 26;
    static final int LIMIT = 34;

    static final int V1_RECORD_COUNT = 42;
    static final int V1_STYPE_IN = 50;
    static final int V1_STYPE_OUT = 51;
    static final int V1_TS_OUT = 52;

    static final int STYPE_IN = 42;
    static final int STYPE_OUT = 43;
    static final int TS_OUT = 44;
    static final int SYMBOL_CSTR_LEN = 45;

    static final int SCHEMA_DEFINITION_LENGTH = 100;

    /** Size of the fixed part of the body, through the schema definition length. */
    static final int FIXED_SIZE = 104;

    /** Total header size is padded to a multiple of this. */
    static final int ALIGNMENT = 8;

    private MetadataLayout() {}
}
