package io.trading.marketdata.dbn.codec;

import io.trading.marketdata.dbn.metadata.MappingInterval;
import io.trading.marketdata.dbn.metadata.Metadata;
import io.trading.marketdata.dbn.metadata.SymbolMapping;
import io.trading.marketdata.dbn.model.SType;
import io.trading.marketdata.dbn.model.Schema;
import org.agrona.MutableDirectBuffer;
import org.agrona.concurrent.UnsafeBuffer;

import java.nio.ByteOrder;
import java.time.LocalDate;
import java.util.List;

/**
 * Writes the DBN metadata header read by {@link MetadataDecoder}, padded to 8 bytes.
 */
public final class MetadataEncoder {

    private static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;

    private MetadataEncoder() {}

    public static byte[] encode(Metadata metadata) {
        int width = metadata.symbolCstrLen();
        int bodySize = MetadataLayout.FIXED_SIZE
            + symbolsSize(metadata.symbols(), width)
            + symbolsSize(metadata.partial(), width)
            + symbolsSize(metadata.notFound(), width)
            + mappingsSize(metadata.mappings(), width);
        int total = align(MetadataLayout.PRELUDE_SIZE + bodySize);

        byte[] bytes = new byte[total];
        UnsafeBuffer buffer = new UnsafeBuffer(bytes);

        // Prelude
        buffer.putBytes(0, MetadataLayout.MAGIC);
        buffer.putByte(3, (byte) metadata.version());
        buffer.putInt(4, total - MetadataLayout.PRELUDE_SIZE, ORDER);

        int base = MetadataLayout.PRELUDE_SIZE;
        encodeFixed(metadata, buffer, base);

        int pos = base + MetadataLayout.FIXED_SIZE;
        pos = writeSymbols(metadata.symbols(), width, buffer, pos);
        pos = writeSymbols(metadata.partial(), width, buffer, pos);
        pos = writeSymbols(metadata.notFound(), width, buffer, pos);
        writeMappings(metadata.mappings(), width, buffer, pos);

        return bytes;
    }

    // ==================== Fixed Fields ====================

    private static void encodeFixed(Metadata metadata, MutableDirectBuffer buffer, int base) {
        CStrings.write(buffer, base + MetadataLayout.DATASET, Metadata.DATASET_CSTR_LEN, metadata.dataset());
        Schema schema = metadata.schema();
        buffer.putShort(base + MetadataLayout.SCHEMA,
            (short) (schema == null ? Schema.MIXED_CODE : schema.code()), ORDER);
        buffer.putLong(base + MetadataLayout.START, metadata.start(), ORDER);
        buffer.putLong(base + MetadataLayout.END, metadata.end(), ORDER);
        buffer.putLong(base + MetadataLayout.LIMIT, metadata.limit(), ORDER);

        SType stypeIn = metadata.stypeIn();
        byte stypeInCode = (byte) (stypeIn == null ? SType.MIXED_CODE : stypeIn.code());
        byte stypeOutCode = (byte) metadata.stypeOut().code();
        byte tsOut = (byte) (metadata.tsOut() ? 1 : 0);

        if (metadata.version() == 1) {
            // record count is not tracked; zero matches an unknown count
            buffer.putLong(base + MetadataLayout.V1_RECORD_COUNT, 0L, ORDER);
            buffer.putByte(base + MetadataLayout.V1_STYPE_IN, stypeInCode);
            buffer.putByte(base + MetadataLayout.V1_STYPE_OUT, stypeOutCode);
            buffer.putByte(base + MetadataLayout.V1_TS_OUT, tsOut);
        } else {
            buffer.putByte(base + MetadataLayout.STYPE_IN, stypeInCode);
            buffer.putByte(base + MetadataLayout.STYPE_OUT, stypeOutCode);
            buffer.putByte(base + MetadataLayout.TS_OUT, tsOut);
            buffer.putShort(base + MetadataLayout.SYMBOL_CSTR_LEN, (short) metadata.symbolCstrLen(), ORDER);
        }
        buffer.putInt(base + MetadataLayout.SCHEMA_DEFINITION_LENGTH, 0, ORDER);
    }

    // ==================== Variable Fields ====================

    private static int writeSymbols(List<String> symbols, int width, MutableDirectBuffer buffer, int pos) {
        buffer.putInt(pos, symbols.size(), ORDER);
        pos += 4;
        for (String symbol : symbols) {
            CStrings.write(buffer, pos, width, symbol);
            pos += width;
        }
        return pos;
    }

    private static void writeMappings(List<SymbolMapping> mappings, int width, MutableDirectBuffer buffer, int pos) {
        buffer.putInt(pos, mappings.size(), ORDER);
        pos += 4;
        for (SymbolMapping mapping : mappings) {
            CStrings.write(buffer, pos, width, mapping.rawSymbol());
            pos += width;
            buffer.putInt(pos, mapping.intervals().size(), ORDER);
            pos += 4;
            for (MappingInterval interval : mapping.intervals()) {
                buffer.putInt(pos, toYyyymmdd(interval.startDate()), ORDER);
                pos += 4;
                buffer.putInt(pos, toYyyymmdd(interval.endDate()), ORDER);
                pos += 4;
                CStrings.write(buffer, pos, width, interval.symbol());
                pos += width;
            }
        }
    }

    private static int symbolsSize(List<String> symbols, int width) {
        return 4 + symbols.size() * width;
    }

    private static int mappingsSize(List<SymbolMapping> mappings, int width) {
        int size = 4;
        for (SymbolMapping mapping : mappings) {
            size += width + 4 + mapping.intervals().size() * (8 + width);
        }
        return size;
    }

    private static int toYyyymmdd(LocalDate date) {
        return date.getYear() * 10_000 + date.getMonthValue() * 100 + date.getDayOfMonth();
    }

    private static int align(int size) {
        int remainder = size % MetadataLayout.ALIGNMENT;
        return remainder == 0 ? size : size + MetadataLayout.ALIGNMENT - remainder;
    }
}
