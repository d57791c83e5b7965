package io.trading.marketdata.dbn.symbology;

import io.trading.marketdata.dbn.error.NotFoundException;
import io.trading.marketdata.dbn.metadata.MappingInterval;
import io.trading.marketdata.dbn.metadata.Metadata;
import io.trading.marketdata.dbn.metadata.SymbolMapping;
import io.trading.marketdata.dbn.model.RType;
import io.trading.marketdata.dbn.model.RecordHeader;
import io.trading.marketdata.dbn.model.SType;
import io.trading.marketdata.dbn.model.TradeMsg;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TimeSeriesSymbolMap.
 */
class TimeSeriesSymbolMapTest {

    private static final LocalDate JAN_2 = LocalDate.of(2024, 1, 2);
    private static final LocalDate JAN_3 = LocalDate.of(2024, 1, 3);

    private static Metadata metadataWith(SType stypeIn, SType stypeOut, SymbolMapping... mappings) {
        return Metadata.builder()
            .dataset("XNAS.ITCH")
            .stypeIn(stypeIn)
            .stypeOut(stypeOut)
            .mappings(List.of(mappings))
            .build();
    }

    @Test
    void testFindWithinInterval() {
        Metadata metadata = metadataWith(SType.RAW_SYMBOL, SType.INSTRUMENT_ID,
            new SymbolMapping("NVDA", List.of(new MappingInterval(JAN_2, JAN_3, "11667"))));

        TimeSeriesSymbolMap map = TimeSeriesSymbolMap.fromMetadata(metadata);

        assertEquals(Optional.of("NVDA"), map.find(JAN_2, 11667));
        assertEquals("NVDA", map.at(JAN_2, 11667));
        assertEquals(1, map.size());
        assertFalse(map.isEmpty());
    }

    @Test
    void testIntervalEndIsExclusive() {
        Metadata metadata = metadataWith(SType.RAW_SYMBOL, SType.INSTRUMENT_ID,
            new SymbolMapping("NVDA", List.of(new MappingInterval(JAN_2, JAN_3, "11667"))));

        TimeSeriesSymbolMap map = TimeSeriesSymbolMap.fromMetadata(metadata);

        assertTrue(map.find(JAN_3, 11667).isEmpty());
        assertTrue(map.find(JAN_2.minusDays(1), 11667).isEmpty());
        assertThrows(NotFoundException.class, () -> map.at(JAN_3, 11667));
    }

    @Test
    void testNumericRawSymbolIsKey() {
        Metadata metadata = metadataWith(SType.INSTRUMENT_ID, SType.RAW_SYMBOL,
            new SymbolMapping("11667", List.of(new MappingInterval(JAN_2, JAN_3, "NVDA"))));

        TimeSeriesSymbolMap map = TimeSeriesSymbolMap.fromMetadata(metadata);

        assertEquals(Optional.of("NVDA"), map.find(JAN_2, 11667));
    }

    @Test
    void testSymbolChangesAcrossIntervals() {
        Metadata metadata = metadataWith(SType.CONTINUOUS, SType.INSTRUMENT_ID,
            new SymbolMapping("ES.c.0", List.of(
                new MappingInterval(JAN_2, JAN_3, "100"),
                new MappingInterval(JAN_3, LocalDate.of(2024, 1, 5), "200"))),
            new SymbolMapping("NQ.c.0", List.of(
                new MappingInterval(JAN_2, LocalDate.of(2024, 1, 5), "300"))));

        TimeSeriesSymbolMap map = TimeSeriesSymbolMap.fromMetadata(metadata);

        assertEquals(3, map.size());
        assertEquals("ES.c.0", map.at(JAN_2, 100));
        assertTrue(map.find(JAN_3, 100).isEmpty());
        assertEquals("ES.c.0", map.at(LocalDate.of(2024, 1, 4), 200));
        assertEquals("NQ.c.0", map.at(LocalDate.of(2024, 1, 4), 300));
    }

    @Test
    void testEmptyIntervalsAreSkipped() {
        Metadata metadata = metadataWith(SType.RAW_SYMBOL, SType.INSTRUMENT_ID,
            new SymbolMapping("NVDA", List.of(
                new MappingInterval(JAN_2, JAN_2, "11667"),
                new MappingInterval(JAN_2, JAN_3, ""))));

        TimeSeriesSymbolMap map = TimeSeriesSymbolMap.fromMetadata(metadata);

        assertTrue(map.isEmpty());
        assertTrue(map.find(JAN_2, 11667).isEmpty());
    }

    @Test
    void testFindByRecordUsesUtcEventDate() {
        TimeSeriesSymbolMap map = new TimeSeriesSymbolMap();
        map.insert(11667, JAN_2, JAN_3, "NVDA");
        // 2024-01-02T23:59:59Z
        long tsEvent = 1_704_239_999_000_000_000L;
        TradeMsg trade = new TradeMsg(RecordHeader.of(RType.MBP_0, 1, 11667, tsEvent),
            1L, 1, 'T', 'N', 0, 0, tsEvent, 0, 1);

        assertEquals(Optional.of("NVDA"), map.find(trade));
        assertEquals("NVDA", map.at(trade));
    }
}
