package io.trading.marketdata.dbn.codec;

import io.trading.marketdata.dbn.model.BidAskPair;
import io.trading.marketdata.dbn.model.CbboMsg;
import io.trading.marketdata.dbn.model.ConsolidatedBidAskPair;
import io.trading.marketdata.dbn.model.ErrorMsg;
import io.trading.marketdata.dbn.model.FixedPrice;
import io.trading.marketdata.dbn.model.ImbalanceMsg;
import io.trading.marketdata.dbn.model.InstrumentDefMsg;
import io.trading.marketdata.dbn.model.Mbp10Msg;
import io.trading.marketdata.dbn.model.RType;
import io.trading.marketdata.dbn.model.Record;
import io.trading.marketdata.dbn.model.RecordHeader;
import io.trading.marketdata.dbn.model.StatMsg;
import io.trading.marketdata.dbn.model.SymbolMappingMsg;
import io.trading.marketdata.dbn.model.TradeMsg;
import io.trading.marketdata.dbn.model.UnixNanos;
import io.trading.marketdata.dbn.model.UnknownRecord;
import org.agrona.ExpandableArrayBuffer;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DbnRecordEncoder, checked against the decoder.
 */
class DbnRecordEncoderTest {

    private static Record roundTrip(Record record) {
        byte[] bytes = DbnRecordEncoder.encode(record);
        return DbnRecordDecoder.decode(bytes, record.rtype());
    }

    @Test
    void testEncodedTradeHasHeaderLengthInWords() {
        TradeMsg trade = new TradeMsg(RecordHeader.of(RType.MBP_0, 2, 11667, 1_000L),
            490_050_000_000L, 100, 'T', 'A', 0x80, 0, 1_001L, 0, 7);

        byte[] bytes = DbnRecordEncoder.encode(trade);

        assertEquals(48, bytes.length);
        assertEquals(12, bytes[0]);
        assertEquals(0x00, bytes[1]);
        assertEquals(trade, DbnRecordDecoder.decode(bytes, 0x00));
    }

    @Test
    void testMbp10KeepsLevelOrder() {
        List<BidAskPair> levels = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            levels.add(new BidAskPair(100L - i, 101L + i, 10 + i, 20 + i, i, 2L * i));
        }
        Mbp10Msg mbp10 = new Mbp10Msg(RecordHeader.of(RType.MBP_10, 1, 3, 5L),
            100L, 1, 'A', 'B', 0, 4, 6L, 12, 99, levels);

        Mbp10Msg decoded = (Mbp10Msg) roundTrip(mbp10);

        assertEquals(mbp10, decoded);
        assertEquals(91L, decoded.levels().get(9).bidPx());
    }

    @Test
    void testInstrumentDefinitionStrings() {
        InstrumentDefMsg def = new InstrumentDefMsg(RecordHeader.of(RType.INSTRUMENT_DEF, 1, 11667, 0L),
            1L, 10_000_000L, 1_000_000_000L, UnixNanos.UNDEF_TIMESTAMP, 0L,
            FixedPrice.UNDEF_PRICE, FixedPrice.UNDEF_PRICE, FixedPrice.UNDEF_PRICE, 490_050_000_000L,
            "USD", "USD", "", "NVDA", "", "XNAS", "NVDA", "ESXXXX", "STK", "", "",
            'K', FixedPrice.UNDEF_PRICE, 'F');

        InstrumentDefMsg decoded = (InstrumentDefMsg) roundTrip(def);

        assertEquals(def, decoded);
        assertEquals("NVDA", decoded.rawSymbol());
        assertEquals("XNAS", decoded.exchange());
    }

    @Test
    void testImbalanceStatAndMappingSurviveEncoding() {
        ImbalanceMsg imbalance = new ImbalanceMsg(RecordHeader.of(RType.IMBALANCE, 1, 2, 3L),
            4L, 5L, 6L, 7L, 8L, 9L, 10L, 11L, 12L, 13L, 14L, 15L, 16L, 'O', 'B', 1, 2, 3, 'A', 'L');
        StatMsg stat = new StatMsg(RecordHeader.of(RType.STATISTICS, 1, 2, 3L),
            4L, 5L, 6L, StatMsg.UNDEF_STAT_QUANTITY, 7L, -8, 9, 10, 1, 2);
        SymbolMappingMsg mapping = new SymbolMappingMsg(RecordHeader.of(RType.SYMBOL_MAPPING, 0, 11667, 0L),
            1, "NVDA", 0, "11667", 0L, UnixNanos.UNDEF_TIMESTAMP);
        ErrorMsg error = new ErrorMsg(RecordHeader.of(RType.ERROR, 0, 0, 0L), "auth failed", 1, true);
        CbboMsg cbbo = new CbboMsg(RecordHeader.of(RType.CBBO_1S, 1, 2, 3L), 4L, 5L, 'N', 0, 6L,
            new ConsolidatedBidAskPair(7L, 8L, 9L, 10L, 11, 12));

        assertEquals(imbalance, roundTrip(imbalance));
        assertEquals(stat, roundTrip(stat));
        assertFalse(((StatMsg) roundTrip(stat)).hasQuantity());
        assertEquals(mapping, roundTrip(mapping));
        assertEquals(error, roundTrip(error));
        assertEquals(cbbo, roundTrip(cbbo));
    }

    @Test
    void testUnknownRecordReemitsRawBytes() {
        byte[] raw = new byte[20];
        raw[0] = 5;
        raw[1] = (byte) 0xC0;
        raw[19] = 9;
        UnknownRecord unknown = (UnknownRecord) DbnRecordDecoder.decode(raw, 0xC0);

        assertArrayEquals(raw, DbnRecordEncoder.encode(unknown));
        assertEquals(20, DbnRecordEncoder.encodedSize(unknown));
    }

    @Test
    void testEncodeIntoBufferAtOffset() {
        TradeMsg trade = new TradeMsg(RecordHeader.of(RType.MBP_0, 1, 1, 1L), 1L, 1, 'T', 'N', 0, 0, 1L, 0, 1);
        ExpandableArrayBuffer buffer = new ExpandableArrayBuffer(128);

        int written = DbnRecordEncoder.encode(trade, buffer, 16);

        assertEquals(48, written);
        assertEquals(trade, DbnRecordDecoder.decode(buffer, 16, written, 0x00));
    }

    @Test
    void testRejectsMismatchedRtype() {
        TradeMsg trade = new TradeMsg(RecordHeader.of(RType.MBO, 1, 1, 1L), 1L, 1, 'T', 'N', 0, 0, 1L, 0, 1);

        assertThrows(IllegalArgumentException.class, () -> DbnRecordEncoder.encode(trade));
    }

    @Test
    void testRejectsOversizedString() {
        ErrorMsg error = new ErrorMsg(RecordHeader.of(RType.ERROR, 0, 0, 0L), "x".repeat(302), 0, false);

        assertThrows(IllegalArgumentException.class, () -> DbnRecordEncoder.encode(error));
    }
}
