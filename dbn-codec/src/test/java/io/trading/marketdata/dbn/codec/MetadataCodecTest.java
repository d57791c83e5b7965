package io.trading.marketdata.dbn.codec;

import io.trading.marketdata.dbn.error.FormatException;
import io.trading.marketdata.dbn.metadata.MappingInterval;
import io.trading.marketdata.dbn.metadata.Metadata;
import io.trading.marketdata.dbn.metadata.SymbolMapping;
import io.trading.marketdata.dbn.model.SType;
import io.trading.marketdata.dbn.model.Schema;
import io.trading.marketdata.dbn.model.UnixNanos;
import org.agrona.concurrent.UnsafeBuffer;
import org.junit.jupiter.api.Test;

import java.nio.ByteOrder;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for MetadataEncoder and MetadataDecoder.
 */
class MetadataCodecTest {

    private static Metadata sampleMetadata(int version) {
        return Metadata.builder()
            .version(version)
            .dataset("XNAS.ITCH")
            .schema(Schema.MBP_1)
            .start(1_704_153_600_000_000_000L)
            .end(1_704_240_000_000_000_000L)
            .limit(0)
            .stypeIn(SType.RAW_SYMBOL)
            .stypeOut(SType.INSTRUMENT_ID)
            .symbols(List.of("NVDA", "AAPL"))
            .partial(List.of("AAPL"))
            .notFound(List.of("ZZZZ"))
            .addMapping(new SymbolMapping("NVDA", List.of(
                new MappingInterval(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 3), "11667"))))
            .build();
    }

    @Test
    void testVersion3RoundTrip() {
        Metadata metadata = sampleMetadata(3);

        byte[] bytes = MetadataEncoder.encode(metadata);

        assertEquals(0, bytes.length % 8);
        assertEquals('D', bytes[0]);
        assertEquals(3, bytes[3]);
        assertEquals(bytes.length, MetadataDecoder.frameLength(new UnsafeBuffer(bytes), 0));
        assertEquals(metadata, MetadataDecoder.decode(bytes));
    }

    @Test
    void testVersion1UsesShortSymbols() {
        Metadata metadata = sampleMetadata(1);

        Metadata decoded = MetadataDecoder.decode(MetadataEncoder.encode(metadata));

        assertEquals(Metadata.V1_SYMBOL_CSTR_LEN, decoded.symbolCstrLen());
        assertEquals(metadata, decoded);
    }

    @Test
    void testMixedSchemaAndInputSymbology() {
        Metadata metadata = Metadata.builder()
            .dataset("GLBX.MDP3")
            .schema(null)
            .stypeIn(null)
            .end(UnixNanos.UNDEF_TIMESTAMP)
            .tsOut(true)
            .build();

        Metadata decoded = MetadataDecoder.decode(MetadataEncoder.encode(metadata));

        assertNull(decoded.schema());
        assertNull(decoded.stypeIn());
        assertTrue(decoded.tsOut());
        assertEquals(UnixNanos.UNDEF_TIMESTAMP, decoded.end());
        assertTrue(decoded.mappings().isEmpty());
    }

    @Test
    void testDecodeIgnoresBytesAfterHeader() {
        byte[] header = MetadataEncoder.encode(sampleMetadata(2));
        byte[] withRecords = Arrays.copyOf(header, header.length + 48);

        assertEquals(sampleMetadata(2), MetadataDecoder.decode(withRecords));
    }

    @Test
    void testBadMagicFails() {
        byte[] bytes = MetadataEncoder.encode(sampleMetadata(3));
        bytes[0] = 'X';

        assertThrows(FormatException.class, () -> MetadataDecoder.decode(bytes));
    }

    @Test
    void testUnsupportedVersionFails() {
        byte[] bytes = MetadataEncoder.encode(sampleMetadata(3));
        bytes[3] = 4;

        FormatException e = assertThrows(FormatException.class, () -> MetadataDecoder.decode(bytes));
        assertTrue(e.getMessage().contains("version"));
    }

    @Test
    void testTruncatedHeaderFails() {
        byte[] bytes = MetadataEncoder.encode(sampleMetadata(3));

        assertThrows(FormatException.class, () -> MetadataDecoder.decode(Arrays.copyOf(bytes, 5)));
        assertThrows(FormatException.class, () -> MetadataDecoder.decode(Arrays.copyOf(bytes, bytes.length - 8)));
    }

    @Test
    void testSchemaDefinitionRejected() {
        byte[] bytes = MetadataEncoder.encode(sampleMetadata(3));
        new UnsafeBuffer(bytes).putInt(8 + 100, 16, ByteOrder.LITTLE_ENDIAN);

        assertThrows(FormatException.class, () -> MetadataDecoder.decode(bytes));
    }

    @Test
    void testUnknownSchemaCodeFails() {
        byte[] bytes = MetadataEncoder.encode(sampleMetadata(3));
        new UnsafeBuffer(bytes).putShort(8 + 16, (short) 200, ByteOrder.LITTLE_ENDIAN);

        assertThrows(FormatException.class, () -> MetadataDecoder.decode(bytes));
    }

    @Test
    void testOversizedSymbolCountFails() {
        byte[] bytes = MetadataEncoder.encode(sampleMetadata(3));
        new UnsafeBuffer(bytes).putInt(8 + 104, 1_000_000, ByteOrder.LITTLE_ENDIAN);

        assertThrows(FormatException.class, () -> MetadataDecoder.decode(bytes));
    }
}
