package io.trading.marketdata.dbn.codec;

import io.trading.marketdata.dbn.error.FormatException;
import io.trading.marketdata.dbn.metadata.MappingInterval;
import io.trading.marketdata.dbn.metadata.Metadata;
import io.trading.marketdata.dbn.metadata.SymbolMapping;
import io.trading.marketdata.dbn.model.SType;
import io.trading.marketdata.dbn.model.Schema;
import org.agrona.DirectBuffer;
import org.agrona.concurrent.UnsafeBuffer;

import java.nio.ByteOrder;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Parses the DBN metadata header that precedes the records of a file or live stream.
 *
 * <p>Supports versions 1 to 3. Every failure surfaces as {@link FormatException}; a partially
 * populated {@link Metadata} is never returned.
 */
public final class MetadataDecoder {

    private static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;

    private MetadataDecoder() {}

    /** Number of bytes needed to call {@link #frameLength(DirectBuffer, int)}. */
    public static int preludeSize() {
        return MetadataLayout.PRELUDE_SIZE;
    }

    /**
     * Validates the prelude at {@code offset} and returns the total size of the metadata
     * header in bytes, prelude included.
     *
     * @throws FormatException on a bad magic or unsupported version
     */
    public static int frameLength(DirectBuffer buffer, int offset) {
        if (buffer.capacity() - offset < MetadataLayout.PRELUDE_SIZE) {
            throw new FormatException("Truncated metadata prelude");
        }
        for (int i = 0; i < MetadataLayout.MAGIC.length; i++) {
            if (buffer.getByte(offset + i) != MetadataLayout.MAGIC[i]) {
                throw new FormatException("Not a DBN stream: bad magic");
            }
        }
        int version = buffer.getByte(offset + 3) & 0xFF;
        if (version < Metadata.MIN_VERSION || version > Metadata.MAX_VERSION) {
            throw new FormatException("Unsupported DBN version: " + version);
        }
        long length = buffer.getInt(offset + 4, ORDER) & 0xFFFF_FFFFL;
        if (length < MetadataLayout.FIXED_SIZE || length > Integer.MAX_VALUE - MetadataLayout.PRELUDE_SIZE) {
            throw new FormatException("Invalid metadata length: " + length);
        }
        return (int) length + MetadataLayout.PRELUDE_SIZE;
    }

    public static Metadata decode(byte[] bytes) {
        return decode(new UnsafeBuffer(bytes), 0, bytes.length);
    }

    /**
     * Decodes a complete metadata header of at most {@code available} bytes at {@code offset}.
     */
    public static Metadata decode(DirectBuffer buffer, int offset, int available) {
        if (available < MetadataLayout.PRELUDE_SIZE) {
            throw new FormatException("Truncated metadata prelude: " + available + " bytes");
        }
        int frameLength = frameLength(buffer, offset);
        if (available < frameLength) {
            throw new FormatException("Truncated metadata header: need " + frameLength
                + " bytes, have " + available);
        }
        int version = buffer.getByte(offset + 3) & 0xFF;
        Cursor cursor = new Cursor(buffer, offset + MetadataLayout.PRELUDE_SIZE, frameLength - MetadataLayout.PRELUDE_SIZE);
        try {
            return decodeBody(cursor, version);
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new FormatException("Malformed metadata: " + e.getMessage(), e);
        }
    }

    // ==================== Body ====================

    private static Metadata decodeBody(Cursor cursor, int version) {
        String dataset = cursor.cstrAt(MetadataLayout.DATASET, Metadata.DATASET_CSTR_LEN, "dataset");
        Schema schema = Schema.fromCode(cursor.u16At(MetadataLayout.SCHEMA));
        long start = cursor.i64At(MetadataLayout.START);
        long end = cursor.i64At(MetadataLayout.END);
        long limit = cursor.i64At(MetadataLayout.LIMIT);

        SType stypeIn;
        SType stypeOut;
        boolean tsOut;
        int symbolCstrLen;
        if (version == 1) {
            stypeIn = SType.fromCode(cursor.u8At(MetadataLayout.V1_STYPE_IN));
            stypeOut = SType.fromCode(cursor.u8At(MetadataLayout.V1_STYPE_OUT));
            tsOut = cursor.u8At(MetadataLayout.V1_TS_OUT) != 0;
            symbolCstrLen = Metadata.V1_SYMBOL_CSTR_LEN;
        } else {
            stypeIn = SType.fromCode(cursor.u8At(MetadataLayout.STYPE_IN));
            stypeOut = SType.fromCode(cursor.u8At(MetadataLayout.STYPE_OUT));
            tsOut = cursor.u8At(MetadataLayout.TS_OUT) != 0;
            symbolCstrLen = cursor.u16At(MetadataLayout.SYMBOL_CSTR_LEN);
        }
        if (stypeOut == null) {
            throw new FormatException("Output symbology cannot be mixed");
        }
        if (symbolCstrLen == 0) {
            throw new FormatException("Symbol width cannot be zero");
        }

        long schemaDefinitionLength = cursor.u32At(MetadataLayout.SCHEMA_DEFINITION_LENGTH);
        if (schemaDefinitionLength != 0) {
            throw new FormatException("Schema definitions are not supported");
        }

        cursor.seek(MetadataLayout.FIXED_SIZE);
        List<String> symbols = readSymbols(cursor, symbolCstrLen, "symbols");
        List<String> partial = readSymbols(cursor, symbolCstrLen, "partial");
        List<String> notFound = readSymbols(cursor, symbolCstrLen, "not_found");
        List<SymbolMapping> mappings = readMappings(cursor, symbolCstrLen);

        return new Metadata(version, dataset, schema, start, end, limit, stypeIn, stypeOut, tsOut,
            symbolCstrLen, symbols, partial, notFound, mappings);
    }

    private static List<String> readSymbols(Cursor cursor, int width, String field) {
        int count = cursor.readCount(width, field);
        List<String> symbols = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            symbols.add(cursor.readCstr(width, field));
        }
        return symbols;
    }

    private static List<SymbolMapping> readMappings(Cursor cursor, int width) {
        int count = cursor.readCount(width + 4, "mappings");
        List<SymbolMapping> mappings = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String rawSymbol = cursor.readCstr(width, "raw_symbol");
            int intervalCount = cursor.readCount(8 + width, "intervals");
            List<MappingInterval> intervals = new ArrayList<>(intervalCount);
            for (int j = 0; j < intervalCount; j++) {
                LocalDate startDate = toDate(cursor.readU32());
                LocalDate endDate = toDate(cursor.readU32());
                String symbol = cursor.readCstr(width, "interval symbol");
                intervals.add(new MappingInterval(startDate, endDate, symbol));
            }
            mappings.add(new SymbolMapping(rawSymbol, intervals));
        }
        return mappings;
    }

    private static LocalDate toDate(long yyyymmdd) {
        int year = (int) (yyyymmdd / 10_000);
        int month = (int) (yyyymmdd / 100 % 100);
        int day = (int) (yyyymmdd % 100);
        try {
            return LocalDate.of(year, month, day);
        } catch (DateTimeException e) {
            throw new FormatException("Invalid mapping date: " + yyyymmdd, e);
        }
    }

    /**
     * Bounds-checked reader over the header body.
     */
    private static final class Cursor {
        private final DirectBuffer buffer;
        private final int base;
        private final int limit;
        private int position;

        Cursor(DirectBuffer buffer, int base, int limit) {
            this.buffer = buffer;
            this.base = base;
            this.limit = limit;
        }

        void seek(int position) {
            this.position = position;
        }

        private void require(int at, int width, String field) {
            if (at < 0 || width < 0 || at > limit - width) {
                throw new FormatException("Truncated metadata reading " + field);
            }
        }

        int u8At(int at) {
            require(at, 1, "u8");
            return buffer.getByte(base + at) & 0xFF;
        }

        int u16At(int at) {
            require(at, 2, "u16");
            return buffer.getShort(base + at, ORDER) & 0xFFFF;
        }

        long u32At(int at) {
            require(at, 4, "u32");
            return buffer.getInt(base + at, ORDER) & 0xFFFF_FFFFL;
        }

        long i64At(int at) {
            require(at, 8, "u64");
            return buffer.getLong(base + at, ORDER);
        }

        String cstrAt(int at, int width, String field) {
            require(at, width, field);
            int terminator = CStrings.terminatorIndex(buffer, base + at, width);
            // a field that fills its width exactly is accepted in the header
            int length = terminator < 0 ? width : terminator;
            return CStrings.decode(buffer, base + at, length);
        }

        long readU32() {
            long value = u32At(position);
            position += 4;
            return value;
        }

        String readCstr(int width, String field) {
            String value = cstrAt(position, width, field);
            position += width;
            return value;
        }

        /**
         * Reads an element count, rejecting counts that cannot fit in the remaining bytes.
         */
        int readCount(int minElementSize, String field) {
            long count = readU32();
            if (count * minElementSize > limit - position) {
                throw new FormatException("Count " + count + " for " + field + " exceeds header length");
            }
            return (int) count;
        }
    }
}
