package io.trading.marketdata.dbn.codec;

import io.trading.marketdata.dbn.error.DecodeException;
import io.trading.marketdata.dbn.model.BboMsg;
import io.trading.marketdata.dbn.model.BidAskPair;
import io.trading.marketdata.dbn.model.CbboMsg;
import io.trading.marketdata.dbn.model.Cmbp1Msg;
import io.trading.marketdata.dbn.model.ConsolidatedBidAskPair;
import io.trading.marketdata.dbn.model.ErrorMsg;
import io.trading.marketdata.dbn.model.ImbalanceMsg;
import io.trading.marketdata.dbn.model.InstrumentDefMsg;
import io.trading.marketdata.dbn.model.MboMsg;
import io.trading.marketdata.dbn.model.Mbp10Msg;
import io.trading.marketdata.dbn.model.Mbp1Msg;
import io.trading.marketdata.dbn.model.OhlcvMsg;
import io.trading.marketdata.dbn.model.RType;
import io.trading.marketdata.dbn.model.Record;
import io.trading.marketdata.dbn.model.RecordHeader;
import io.trading.marketdata.dbn.model.StatMsg;
import io.trading.marketdata.dbn.model.StatusMsg;
import io.trading.marketdata.dbn.model.SymbolMappingMsg;
import io.trading.marketdata.dbn.model.SystemMsg;
import io.trading.marketdata.dbn.model.TradeMsg;
import io.trading.marketdata.dbn.model.UnknownRecord;
import org.agrona.DirectBuffer;
import org.agrona.concurrent.UnsafeBuffer;

import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes DBN records from little-endian binary buffers.
 *
 * <p>Dispatch is a single 256-entry table indexed by the rtype byte. Tags without an entry
 * decode to {@link UnknownRecord}. The decoder holds no mutable state and is safe to call
 * from any thread.
 */
public final class DbnRecordDecoder {

    private static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;

    @FunctionalInterface
    private interface BodyDecoder {
        Record decode(DirectBuffer buffer, int offset, int length, RecordHeader header);
    }

    private static final BodyDecoder[] DECODERS = new BodyDecoder[256];

    static {
        register(RType.MBP_0, DbnRecordDecoder::decodeTrade);
        register(RType.MBP_1, DbnRecordDecoder::decodeMbp1);
        register(RType.MBP_10, DbnRecordDecoder::decodeMbp10);
        register(RType.OHLCV_1S, DbnRecordDecoder::decodeOhlcv);
        register(RType.OHLCV_1M, DbnRecordDecoder::decodeOhlcv);
        register(RType.OHLCV_1H, DbnRecordDecoder::decodeOhlcv);
        register(RType.OHLCV_1D, DbnRecordDecoder::decodeOhlcv);
        register(RType.OHLCV_EOD, DbnRecordDecoder::decodeOhlcv);
        register(RType.STATUS, DbnRecordDecoder::decodeStatus);
        register(RType.INSTRUMENT_DEF, DbnRecordDecoder::decodeInstrumentDef);
        register(RType.IMBALANCE, DbnRecordDecoder::decodeImbalance);
        register(RType.ERROR, DbnRecordDecoder::decodeError);
        register(RType.SYMBOL_MAPPING, DbnRecordDecoder::decodeSymbolMapping);
        register(RType.SYSTEM, DbnRecordDecoder::decodeSystem);
        register(RType.STATISTICS, DbnRecordDecoder::decodeStat);
        register(RType.MBO, DbnRecordDecoder::decodeMbo);
        register(RType.CMBP_1, DbnRecordDecoder::decodeCmbp1);
        register(RType.CBBO_1S, DbnRecordDecoder::decodeCbbo);
        register(RType.CBBO_1M, DbnRecordDecoder::decodeCbbo);
        register(RType.TCBBO, DbnRecordDecoder::decodeCbbo);
        register(RType.BBO_1S, DbnRecordDecoder::decodeBbo);
        register(RType.BBO_1M, DbnRecordDecoder::decodeBbo);
    }

    private DbnRecordDecoder() {}

    private static void register(RType rtype, BodyDecoder decoder) {
        DECODERS[rtype.code()] = decoder;
    }

    // ==================== Entry Points ====================

    /**
     * Decodes a record from the whole of {@code bytes}, dispatching on {@code rtype}.
     *
     * @throws DecodeException if the bytes are shorter than the fixed size of the rtype,
     *                         or a fixed-width string field is not NUL-terminated
     */
    public static Record decode(byte[] bytes, int rtype) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes cannot be null");
        }
        return decode(new UnsafeBuffer(bytes), 0, bytes.length, rtype);
    }

    /**
     * Decodes a raw record. The record's bytes are not retained.
     */
    public static Record decode(RawRecord raw) {
        return decode(raw.buffer(), raw.offset(), raw.length(), raw.rtype());
    }

    /**
     * Decodes a record from {@code length} bytes of {@code buffer} starting at {@code offset}.
     * Bytes beyond the fixed size of the rtype are ignored.
     */
    public static Record decode(DirectBuffer buffer, int offset, int length, int rtype) {
        if (buffer == null) {
            throw new IllegalArgumentException("buffer cannot be null");
        }
        if (offset < 0 || length < 0 || offset > buffer.capacity() - length) {
            throw new IllegalArgumentException(
                "region [" + offset + ", " + length + "] out of bounds for capacity " + buffer.capacity());
        }
        if (rtype < 0 || rtype > 0xFF) {
            throw new IllegalArgumentException("rtype out of range: " + rtype);
        }

        int minimum = RType.minimumSize(rtype);
        if (length < minimum) {
            throw new DecodeException(
                "Record with rtype 0x" + Integer.toHexString(rtype) + " needs " + minimum
                    + " bytes but only " + length + " available", rtype, length);
        }

        RecordHeader header = decodeHeader(buffer, offset, rtype);
        BodyDecoder decoder = DECODERS[rtype];
        if (decoder == null) {
            byte[] raw = new byte[length];
            buffer.getBytes(offset, raw);
            return new UnknownRecord(header, raw);
        }
        return decoder.decode(buffer, offset, length, header);
    }

    // ==================== Header ====================

    private static RecordHeader decodeHeader(DirectBuffer buffer, int offset, int rtype) {
        int pos = offset;

        int length = u8(buffer, pos);
        pos += 2; // length + rtype

        int publisherId = u16(buffer, pos);
        pos += 2;

        long instrumentId = u32(buffer, pos);
        pos += 4;

        long tsEvent = buffer.getLong(pos, ORDER);

        return new RecordHeader(length, rtype, publisherId, instrumentId, tsEvent);
    }

    // ==================== Book and Trade Records ====================

    private static TradeMsg decodeTrade(DirectBuffer buffer, int offset, int length, RecordHeader header) {
        int pos = offset + RType.HEADER_SIZE;

        long price = buffer.getLong(pos, ORDER);
        pos += 8;
        long size = u32(buffer, pos);
        pos += 4;
        char action = chr(buffer, pos);
        pos += 1;
        char side = chr(buffer, pos);
        pos += 1;
        int flags = u8(buffer, pos);
        pos += 1;
        int depth = u8(buffer, pos);
        pos += 1;
        long tsRecv = buffer.getLong(pos, ORDER);
        pos += 8;
        int tsInDelta = buffer.getInt(pos, ORDER);
        pos += 4;
        long sequence = u32(buffer, pos);

        return new TradeMsg(header, price, size, action, side, flags, depth, tsRecv, tsInDelta, sequence);
    }

    private static Mbp1Msg decodeMbp1(DirectBuffer buffer, int offset, int length, RecordHeader header) {
        TradeMsg top = decodeTrade(buffer, offset, length, header);
        BidAskPair level = decodeBidAskPair(buffer, offset + 48);
        return new Mbp1Msg(header, top.price(), top.size(), top.action(), top.side(), top.flags(),
            top.depth(), top.tsRecv(), top.tsInDelta(), top.sequence(), level);
    }

    private static Mbp10Msg decodeMbp10(DirectBuffer buffer, int offset, int length, RecordHeader header) {
        TradeMsg top = decodeTrade(buffer, offset, length, header);
        List<BidAskPair> levels = new ArrayList<>(Mbp10Msg.LEVEL_COUNT);
        int pos = offset + 48;
        for (int i = 0; i < Mbp10Msg.LEVEL_COUNT; i++) {
            levels.add(decodeBidAskPair(buffer, pos));
            pos += BidAskPair.SIZE;
        }
        return new Mbp10Msg(header, top.price(), top.size(), top.action(), top.side(), top.flags(),
            top.depth(), top.tsRecv(), top.tsInDelta(), top.sequence(), levels);
    }

    private static MboMsg decodeMbo(DirectBuffer buffer, int offset, int length, RecordHeader header) {
        int pos = offset + RType.HEADER_SIZE;

        long orderId = buffer.getLong(pos, ORDER);
        pos += 8;
        long price = buffer.getLong(pos, ORDER);
        pos += 8;
        long size = u32(buffer, pos);
        pos += 4;
        int flags = u8(buffer, pos);
        pos += 1;
        int channelId = u8(buffer, pos);
        pos += 1;
        char action = chr(buffer, pos);
        pos += 1;
        char side = chr(buffer, pos);
        pos += 1;
        long tsRecv = buffer.getLong(pos, ORDER);
        pos += 8;
        int tsInDelta = buffer.getInt(pos, ORDER);
        pos += 4;
        long sequence = u32(buffer, pos);

        return new MboMsg(header, orderId, price, size, flags, channelId, action, side,
            tsRecv, tsInDelta, sequence);
    }

    private static BboMsg decodeBbo(DirectBuffer buffer, int offset, int length, RecordHeader header) {
        long price = buffer.getLong(offset + 16, ORDER);
        long size = u32(buffer, offset + 24);
        char side = chr(buffer, offset + 29);
        int flags = u8(buffer, offset + 30);
        long tsRecv = buffer.getLong(offset + 32, ORDER);
        long sequence = u32(buffer, offset + 44);
        BidAskPair level = decodeBidAskPair(buffer, offset + 48);
        return new BboMsg(header, price, size, side, flags, tsRecv, sequence, level);
    }

    private static CbboMsg decodeCbbo(DirectBuffer buffer, int offset, int length, RecordHeader header) {
        long price = buffer.getLong(offset + 16, ORDER);
        long size = u32(buffer, offset + 24);
        char side = chr(buffer, offset + 29);
        int flags = u8(buffer, offset + 30);
        long tsRecv = buffer.getLong(offset + 32, ORDER);
        ConsolidatedBidAskPair level = decodeConsolidatedPair(buffer, offset + 48);
        return new CbboMsg(header, price, size, side, flags, tsRecv, level);
    }

    private static Cmbp1Msg decodeCmbp1(DirectBuffer buffer, int offset, int length, RecordHeader header) {
        long price = buffer.getLong(offset + 16, ORDER);
        long size = u32(buffer, offset + 24);
        char action = chr(buffer, offset + 28);
        char side = chr(buffer, offset + 29);
        int flags = u8(buffer, offset + 30);
        long tsRecv = buffer.getLong(offset + 32, ORDER);
        int tsInDelta = buffer.getInt(offset + 40, ORDER);
        ConsolidatedBidAskPair level = decodeConsolidatedPair(buffer, offset + 48);
        return new Cmbp1Msg(header, price, size, action, side, flags, tsRecv, tsInDelta, level);
    }

    private static BidAskPair decodeBidAskPair(DirectBuffer buffer, int offset) {
        return new BidAskPair(
            buffer.getLong(offset, ORDER),
            buffer.getLong(offset + 8, ORDER),
            u32(buffer, offset + 16),
            u32(buffer, offset + 20),
            u32(buffer, offset + 24),
            u32(buffer, offset + 28));
    }

    private static ConsolidatedBidAskPair decodeConsolidatedPair(DirectBuffer buffer, int offset) {
        return new ConsolidatedBidAskPair(
            buffer.getLong(offset, ORDER),
            buffer.getLong(offset + 8, ORDER),
            u32(buffer, offset + 16),
            u32(buffer, offset + 20),
            u16(buffer, offset + 24),
            u16(buffer, offset + 28));
    }

    // ==================== Bars and Statistics ====================

    private static OhlcvMsg decodeOhlcv(DirectBuffer buffer, int offset, int length, RecordHeader header) {
        int pos = offset + RType.HEADER_SIZE;

        long open = buffer.getLong(pos, ORDER);
        pos += 8;
        long high = buffer.getLong(pos, ORDER);
        pos += 8;
        long low = buffer.getLong(pos, ORDER);
        pos += 8;
        long close = buffer.getLong(pos, ORDER);
        pos += 8;
        long volume = buffer.getLong(pos, ORDER);

        return new OhlcvMsg(header, open, high, low, close, volume);
    }

    private static StatMsg decodeStat(DirectBuffer buffer, int offset, int length, RecordHeader header) {
        int pos = offset + RType.HEADER_SIZE;

        long tsRecv = buffer.getLong(pos, ORDER);
        pos += 8;
        long tsRef = buffer.getLong(pos, ORDER);
        pos += 8;
        long price = buffer.getLong(pos, ORDER);
        pos += 8;
        long quantity = buffer.getLong(pos, ORDER);
        pos += 8;
        long sequence = u32(buffer, pos);
        pos += 4;
        int tsInDelta = buffer.getInt(pos, ORDER);
        pos += 4;
        int statType = u16(buffer, pos);
        pos += 2;
        int channelId = u16(buffer, pos);
        pos += 2;
        int updateAction = u8(buffer, pos);
        pos += 1;
        int statFlags = u8(buffer, pos);

        return new StatMsg(header, tsRecv, tsRef, price, quantity, sequence, tsInDelta,
            statType, channelId, updateAction, statFlags);
    }

    private static StatusMsg decodeStatus(DirectBuffer buffer, int offset, int length, RecordHeader header) {
        int pos = offset + RType.HEADER_SIZE;

        long tsRecv = buffer.getLong(pos, ORDER);
        pos += 8;
        int action = u16(buffer, pos);
        pos += 2;
        int reason = u16(buffer, pos);
        pos += 2;
        int tradingEvent = u16(buffer, pos);
        pos += 2;
        char isTrading = chr(buffer, pos);
        pos += 1;
        char isQuoting = chr(buffer, pos);
        pos += 1;
        char isShortSellRestricted = chr(buffer, pos);

        return new StatusMsg(header, tsRecv, action, reason, tradingEvent,
            isTrading, isQuoting, isShortSellRestricted);
    }

    private static ImbalanceMsg decodeImbalance(DirectBuffer buffer, int offset, int length, RecordHeader header) {
        int pos = offset + RType.HEADER_SIZE;

        long tsRecv = buffer.getLong(pos, ORDER);
        long refPrice = buffer.getLong(pos + 8, ORDER);
        long auctionTime = buffer.getLong(pos + 16, ORDER);
        long contBookClrPrice = buffer.getLong(pos + 24, ORDER);
        long aucInterestClrPrice = buffer.getLong(pos + 32, ORDER);
        long ssrFillingPrice = buffer.getLong(pos + 40, ORDER);
        long indMatchPrice = buffer.getLong(pos + 48, ORDER);
        long upperCollar = buffer.getLong(pos + 56, ORDER);
        long lowerCollar = buffer.getLong(pos + 64, ORDER);
        pos += 72;

        long pairedQty = u32(buffer, pos);
        long totalImbalanceQty = u32(buffer, pos + 4);
        long marketImbalanceQty = u32(buffer, pos + 8);
        long unpairedQty = u32(buffer, pos + 12);
        pos += 16;

        char auctionType = chr(buffer, pos);
        char side = chr(buffer, pos + 1);
        int auctionStatus = u8(buffer, pos + 2);
        int freezeStatus = u8(buffer, pos + 3);
        int numExtensions = u8(buffer, pos + 4);
        char unpairedSide = chr(buffer, pos + 5);
        char significantImbalance = chr(buffer, pos + 6);

        return new ImbalanceMsg(header, tsRecv, refPrice, auctionTime, contBookClrPrice,
            aucInterestClrPrice, ssrFillingPrice, indMatchPrice, upperCollar, lowerCollar,
            pairedQty, totalImbalanceQty, marketImbalanceQty, unpairedQty, auctionType, side,
            auctionStatus, freezeStatus, numExtensions, unpairedSide, significantImbalance);
    }

    // ==================== Reference Data ====================

    private static InstrumentDefMsg decodeInstrumentDef(
        DirectBuffer buffer, int offset, int length, RecordHeader header) {
        return new InstrumentDefMsg(
            header,
            buffer.getLong(offset + InstrumentDefLayout.TS_RECV, ORDER),
            buffer.getLong(offset + InstrumentDefLayout.MIN_PRICE_INCREMENT, ORDER),
            buffer.getLong(offset + InstrumentDefLayout.DISPLAY_FACTOR, ORDER),
            buffer.getLong(offset + InstrumentDefLayout.EXPIRATION, ORDER),
            buffer.getLong(offset + InstrumentDefLayout.ACTIVATION, ORDER),
            buffer.getLong(offset + InstrumentDefLayout.HIGH_LIMIT_PRICE, ORDER),
            buffer.getLong(offset + InstrumentDefLayout.LOW_LIMIT_PRICE, ORDER),
            buffer.getLong(offset + InstrumentDefLayout.MAX_PRICE_VARIATION, ORDER),
            buffer.getLong(offset + InstrumentDefLayout.TRADING_REFERENCE_PRICE, ORDER),
            cstr(buffer, offset, InstrumentDefLayout.CURRENCY, InstrumentDefLayout.CURRENCY_WIDTH,
                length, header, "currency"),
            cstr(buffer, offset, InstrumentDefLayout.SETTL_CURRENCY, InstrumentDefLayout.CURRENCY_WIDTH,
                length, header, "settl_currency"),
            cstr(buffer, offset, InstrumentDefLayout.SECSUBTYPE, InstrumentDefLayout.SECSUBTYPE_WIDTH,
                length, header, "secsubtype"),
            cstr(buffer, offset, InstrumentDefLayout.RAW_SYMBOL, InstrumentDefLayout.RAW_SYMBOL_WIDTH,
                length, header, "raw_symbol"),
            cstr(buffer, offset, InstrumentDefLayout.GROUP, InstrumentDefLayout.GROUP_WIDTH,
                length, header, "group"),
            cstr(buffer, offset, InstrumentDefLayout.EXCHANGE, InstrumentDefLayout.EXCHANGE_WIDTH,
                length, header, "exchange"),
            cstr(buffer, offset, InstrumentDefLayout.ASSET, InstrumentDefLayout.ASSET_WIDTH,
                length, header, "asset"),
            cstr(buffer, offset, InstrumentDefLayout.CFI, InstrumentDefLayout.CFI_WIDTH,
                length, header, "cfi"),
            cstr(buffer, offset, InstrumentDefLayout.SECURITY_TYPE, InstrumentDefLayout.SECURITY_TYPE_WIDTH,
                length, header, "security_type"),
            cstr(buffer, offset, InstrumentDefLayout.UNIT_OF_MEASURE, InstrumentDefLayout.UNIT_OF_MEASURE_WIDTH,
                length, header, "unit_of_measure"),
            cstr(buffer, offset, InstrumentDefLayout.UNDERLYING, InstrumentDefLayout.UNDERLYING_WIDTH,
                length, header, "underlying"),
            chr(buffer, offset + InstrumentDefLayout.INSTRUMENT_CLASS),
            buffer.getLong(offset + InstrumentDefLayout.STRIKE_PRICE, ORDER),
            chr(buffer, offset + InstrumentDefLayout.MATCH_ALGORITHM));
    }

    private static SymbolMappingMsg decodeSymbolMapping(
        DirectBuffer buffer, int offset, int length, RecordHeader header) {
        int pos = offset + RType.HEADER_SIZE;

        int stypeIn = u8(buffer, pos);
        pos += 1;
        String stypeInSymbol = cstr(
            buffer, pos, 0, SymbolMappingLayout.SYMBOL_WIDTH, length, header, "stype_in_symbol");
        pos += SymbolMappingLayout.SYMBOL_WIDTH;
        int stypeOut = u8(buffer, pos);
        pos += 1;
        String stypeOutSymbol = cstr(
            buffer, pos, 0, SymbolMappingLayout.SYMBOL_WIDTH, length, header, "stype_out_symbol");
        pos += SymbolMappingLayout.SYMBOL_WIDTH;
        long startTs = buffer.getLong(pos, ORDER);
        pos += 8;
        long endTs = buffer.getLong(pos, ORDER);

        return new SymbolMappingMsg(header, stypeIn, stypeInSymbol, stypeOut, stypeOutSymbol, startTs, endTs);
    }

    // ==================== Gateway Messages ====================

    private static ErrorMsg decodeError(DirectBuffer buffer, int offset, int length, RecordHeader header) {
        String err = cstr(buffer, offset, RType.HEADER_SIZE, GatewayMessageLayout.ERR_WIDTH, length, header, "err");
        int pos = offset + RType.HEADER_SIZE + GatewayMessageLayout.ERR_WIDTH;
        int code = u8(buffer, pos);
        boolean isLast = u8(buffer, pos + 1) != 0;
        return new ErrorMsg(header, err, code, isLast);
    }

    private static SystemMsg decodeSystem(DirectBuffer buffer, int offset, int length, RecordHeader header) {
        String msg = cstr(buffer, offset, RType.HEADER_SIZE, GatewayMessageLayout.MSG_WIDTH, length, header, "msg");
        int code = u8(buffer, offset + RType.HEADER_SIZE + GatewayMessageLayout.MSG_WIDTH);
        return new SystemMsg(header, msg, code);
    }

    // ==================== Helper Methods ====================

    private static int u8(DirectBuffer buffer, int index) {
        return buffer.getByte(index) & 0xFF;
    }

    private static int u16(DirectBuffer buffer, int index) {
        return buffer.getShort(index, ORDER) & 0xFFFF;
    }

    private static long u32(DirectBuffer buffer, int index) {
        return buffer.getInt(index, ORDER) & 0xFFFF_FFFFL;
    }

    private static char chr(DirectBuffer buffer, int index) {
        return (char) (buffer.getByte(index) & 0xFF);
    }

    private static String cstr(DirectBuffer buffer, int recordOffset, int fieldOffset, int width,
                               int length, RecordHeader header, String field) {
        int start = recordOffset + fieldOffset;
        int terminator = CStrings.terminatorIndex(buffer, start, width);
        if (terminator < 0) {
            throw new DecodeException(
                "Field " + field + " is not NUL-terminated within " + width + " bytes",
                header.rtype(), length);
        }
        return CStrings.decode(buffer, start, terminator);
    }
}
