package io.trading.marketdata.dbn.codec;

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
import org.agrona.MutableDirectBuffer;
import org.agrona.concurrent.UnsafeBuffer;

import java.nio.ByteOrder;

/**
 * Encodes records into the little-endian layout read by {@link DbnRecordDecoder}.
 *
 * <p>Known records are written at the fixed size of their rtype, with the header length
 * byte set to that size in 4-byte units. Unknown records re-emit their raw bytes.
 */
public final class DbnRecordEncoder {

    private static final ByteOrder ORDER = ByteOrder.LITTLE_ENDIAN;

    private DbnRecordEncoder() {}

    // ==================== Entry Points ====================

    /**
     * Encodes a record into a new byte array.
     */
    public static byte[] encode(Record record) {
        if (record instanceof UnknownRecord unknown) {
            return unknown.rawBytes();
        }
        byte[] bytes = new byte[encodedSize(record)];
        encode(record, new UnsafeBuffer(bytes), 0);
        return bytes;
    }

    /**
     * Number of bytes {@link #encode(Record, MutableDirectBuffer, int)} writes for a record.
     */
    public static int encodedSize(Record record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (record instanceof UnknownRecord unknown) {
            return unknown.byteLength();
        }
        RType rtype = RType.fromCode(record.rtype());
        if (rtype == null) {
            throw new IllegalArgumentException("Unknown rtype 0x" + Integer.toHexString(record.rtype())
                + " on " + record.getClass().getSimpleName());
        }
        return rtype.size();
    }

    /**
     * Encodes a record into {@code buffer} at {@code offset}.
     *
     * @return the number of bytes written
     */
    public static int encode(Record record, MutableDirectBuffer buffer, int offset) {
        int size = encodedSize(record);
        if (record instanceof UnknownRecord unknown) {
            buffer.putBytes(offset, unknown.rawBytes());
            return size;
        }

        checkVariant(record);
        buffer.setMemory(offset, size, (byte) 0);
        encodeHeader(record.header(), size, buffer, offset);

        if (record instanceof TradeMsg trade) {
            encodeTrade(trade, buffer, offset);
        } else if (record instanceof Mbp1Msg mbp1) {
            encodeMbp1(mbp1, buffer, offset);
        } else if (record instanceof Mbp10Msg mbp10) {
            encodeMbp10(mbp10, buffer, offset);
        } else if (record instanceof MboMsg mbo) {
            encodeMbo(mbo, buffer, offset);
        } else if (record instanceof BboMsg bbo) {
            encodeBbo(bbo, buffer, offset);
        } else if (record instanceof CbboMsg cbbo) {
            encodeCbbo(cbbo, buffer, offset);
        } else if (record instanceof Cmbp1Msg cmbp1) {
            encodeCmbp1(cmbp1, buffer, offset);
        } else if (record instanceof OhlcvMsg ohlcv) {
            encodeOhlcv(ohlcv, buffer, offset);
        } else if (record instanceof StatMsg stat) {
            encodeStat(stat, buffer, offset);
        } else if (record instanceof StatusMsg status) {
            encodeStatus(status, buffer, offset);
        } else if (record instanceof ImbalanceMsg imbalance) {
            encodeImbalance(imbalance, buffer, offset);
        } else if (record instanceof InstrumentDefMsg definition) {
            encodeInstrumentDef(definition, buffer, offset);
        } else if (record instanceof SymbolMappingMsg mapping) {
            encodeSymbolMapping(mapping, buffer, offset);
        } else if (record instanceof ErrorMsg error) {
            encodeError(error, buffer, offset);
        } else if (record instanceof SystemMsg system) {
            encodeSystem(system, buffer, offset);
        }
        return size;
    }

    // ==================== Header ====================

    private static void encodeHeader(RecordHeader header, int size, MutableDirectBuffer buffer, int offset) {
        int pos = offset;

        buffer.putByte(pos, (byte) (size / RType.LENGTH_MULTIPLIER));
        pos += 1;
        buffer.putByte(pos, (byte) header.rtype());
        pos += 1;
        buffer.putShort(pos, (short) header.publisherId(), ORDER);
        pos += 2;
        buffer.putInt(pos, (int) header.instrumentId(), ORDER);
        pos += 4;
        buffer.putLong(pos, header.tsEvent(), ORDER);
    }

    // ==================== Book and Trade Records ====================

    private static void encodeTrade(TradeMsg trade, MutableDirectBuffer buffer, int offset) {
        encodeTop(buffer, offset, trade.price(), trade.size(), trade.action(), trade.side(), trade.flags(),
            trade.depth(), trade.tsRecv(), trade.tsInDelta(), trade.sequence());
    }

    private static void encodeMbp1(Mbp1Msg mbp1, MutableDirectBuffer buffer, int offset) {
        encodeTop(buffer, offset, mbp1.price(), mbp1.size(), mbp1.action(), mbp1.side(), mbp1.flags(),
            mbp1.depth(), mbp1.tsRecv(), mbp1.tsInDelta(), mbp1.sequence());
        encodeBidAskPair(mbp1.level(), buffer, offset + 48);
    }

    private static void encodeMbp10(Mbp10Msg mbp10, MutableDirectBuffer buffer, int offset) {
        encodeTop(buffer, offset, mbp10.price(), mbp10.size(), mbp10.action(), mbp10.side(), mbp10.flags(),
            mbp10.depth(), mbp10.tsRecv(), mbp10.tsInDelta(), mbp10.sequence());
        int pos = offset + 48;
        for (BidAskPair level : mbp10.levels()) {
            encodeBidAskPair(level, buffer, pos);
            pos += BidAskPair.SIZE;
        }
    }

    private static void encodeTop(MutableDirectBuffer buffer, int offset, long price, long size, char action,
                                  char side, int flags, int depth, long tsRecv, int tsInDelta, long sequence) {
        int pos = offset + RType.HEADER_SIZE;

        buffer.putLong(pos, price, ORDER);
        pos += 8;
        buffer.putInt(pos, (int) size, ORDER);
        pos += 4;
        buffer.putByte(pos, (byte) action);
        pos += 1;
        buffer.putByte(pos, (byte) side);
        pos += 1;
        buffer.putByte(pos, (byte) flags);
        pos += 1;
        buffer.putByte(pos, (byte) depth);
        pos += 1;
        buffer.putLong(pos, tsRecv, ORDER);
        pos += 8;
        buffer.putInt(pos, tsInDelta, ORDER);
        pos += 4;
        buffer.putInt(pos, (int) sequence, ORDER);
    }

    private static void encodeMbo(MboMsg mbo, MutableDirectBuffer buffer, int offset) {
        int pos = offset + RType.HEADER_SIZE;

        buffer.putLong(pos, mbo.orderId(), ORDER);
        pos += 8;
        buffer.putLong(pos, mbo.price(), ORDER);
        pos += 8;
        buffer.putInt(pos, (int) mbo.size(), ORDER);
        pos += 4;
        buffer.putByte(pos, (byte) mbo.flags());
        pos += 1;
        buffer.putByte(pos, (byte) mbo.channelId());
        pos += 1;
        buffer.putByte(pos, (byte) mbo.action());
        pos += 1;
        buffer.putByte(pos, (byte) mbo.side());
        pos += 1;
        buffer.putLong(pos, mbo.tsRecv(), ORDER);
        pos += 8;
        buffer.putInt(pos, mbo.tsInDelta(), ORDER);
        pos += 4;
        buffer.putInt(pos, (int) mbo.sequence(), ORDER);
    }

    private static void encodeBbo(BboMsg bbo, MutableDirectBuffer buffer, int offset) {
        buffer.putLong(offset + 16, bbo.price(), ORDER);
        buffer.putInt(offset + 24, (int) bbo.size(), ORDER);
        buffer.putByte(offset + 29, (byte) bbo.side());
        buffer.putByte(offset + 30, (byte) bbo.flags());
        buffer.putLong(offset + 32, bbo.tsRecv(), ORDER);
        buffer.putInt(offset + 44, (int) bbo.sequence(), ORDER);
        encodeBidAskPair(bbo.level(), buffer, offset + 48);
    }

    private static void encodeCbbo(CbboMsg cbbo, MutableDirectBuffer buffer, int offset) {
        buffer.putLong(offset + 16, cbbo.price(), ORDER);
        buffer.putInt(offset + 24, (int) cbbo.size(), ORDER);
        buffer.putByte(offset + 29, (byte) cbbo.side());
        buffer.putByte(offset + 30, (byte) cbbo.flags());
        buffer.putLong(offset + 32, cbbo.tsRecv(), ORDER);
        encodeConsolidatedPair(cbbo.level(), buffer, offset + 48);
    }

    private static void encodeCmbp1(Cmbp1Msg cmbp1, MutableDirectBuffer buffer, int offset) {
        buffer.putLong(offset + 16, cmbp1.price(), ORDER);
        buffer.putInt(offset + 24, (int) cmbp1.size(), ORDER);
        buffer.putByte(offset + 28, (byte) cmbp1.action());
        buffer.putByte(offset + 29, (byte) cmbp1.side());
        buffer.putByte(offset + 30, (byte) cmbp1.flags());
        buffer.putLong(offset + 32, cmbp1.tsRecv(), ORDER);
        buffer.putInt(offset + 40, cmbp1.tsInDelta(), ORDER);
        encodeConsolidatedPair(cmbp1.level(), buffer, offset + 48);
    }

    private static void encodeBidAskPair(BidAskPair level, MutableDirectBuffer buffer, int offset) {
        buffer.putLong(offset, level.bidPx(), ORDER);
        buffer.putLong(offset + 8, level.askPx(), ORDER);
        buffer.putInt(offset + 16, (int) level.bidSz(), ORDER);
        buffer.putInt(offset + 20, (int) level.askSz(), ORDER);
        buffer.putInt(offset + 24, (int) level.bidCt(), ORDER);
        buffer.putInt(offset + 28, (int) level.askCt(), ORDER);
    }

    private static void encodeConsolidatedPair(ConsolidatedBidAskPair level, MutableDirectBuffer buffer, int offset) {
        buffer.putLong(offset, level.bidPx(), ORDER);
        buffer.putLong(offset + 8, level.askPx(), ORDER);
        buffer.putInt(offset + 16, (int) level.bidSz(), ORDER);
        buffer.putInt(offset + 20, (int) level.askSz(), ORDER);
        buffer.putShort(offset + 24, (short) level.bidPb(), ORDER);
        buffer.putShort(offset + 28, (short) level.askPb(), ORDER);
    }

    // ==================== Bars and Statistics ====================

    private static void encodeOhlcv(OhlcvMsg ohlcv, MutableDirectBuffer buffer, int offset) {
        int pos = offset + RType.HEADER_SIZE;

        buffer.putLong(pos, ohlcv.open(), ORDER);
        pos += 8;
        buffer.putLong(pos, ohlcv.high(), ORDER);
        pos += 8;
        buffer.putLong(pos, ohlcv.low(), ORDER);
        pos += 8;
        buffer.putLong(pos, ohlcv.close(), ORDER);
        pos += 8;
        buffer.putLong(pos, ohlcv.volume(), ORDER);
    }

    private static void encodeStat(StatMsg stat, MutableDirectBuffer buffer, int offset) {
        int pos = offset + RType.HEADER_SIZE;

        buffer.putLong(pos, stat.tsRecv(), ORDER);
        pos += 8;
        buffer.putLong(pos, stat.tsRef(), ORDER);
        pos += 8;
        buffer.putLong(pos, stat.price(), ORDER);
        pos += 8;
        buffer.putLong(pos, stat.quantity(), ORDER);
        pos += 8;
        buffer.putInt(pos, (int) stat.sequence(), ORDER);
        pos += 4;
        buffer.putInt(pos, stat.tsInDelta(), ORDER);
        pos += 4;
        buffer.putShort(pos, (short) stat.statType(), ORDER);
        pos += 2;
        buffer.putShort(pos, (short) stat.channelId(), ORDER);
        pos += 2;
        buffer.putByte(pos, (byte) stat.updateAction());
        pos += 1;
        buffer.putByte(pos, (byte) stat.statFlags());
    }

    private static void encodeStatus(StatusMsg status, MutableDirectBuffer buffer, int offset) {
        int pos = offset + RType.HEADER_SIZE;

        buffer.putLong(pos, status.tsRecv(), ORDER);
        pos += 8;
        buffer.putShort(pos, (short) status.action(), ORDER);
        pos += 2;
        buffer.putShort(pos, (short) status.reason(), ORDER);
        pos += 2;
        buffer.putShort(pos, (short) status.tradingEvent(), ORDER);
        pos += 2;
        buffer.putByte(pos, (byte) status.isTrading());
        pos += 1;
        buffer.putByte(pos, (byte) status.isQuoting());
        pos += 1;
        buffer.putByte(pos, (byte) status.isShortSellRestricted());
    }

    private static void encodeImbalance(ImbalanceMsg imbalance, MutableDirectBuffer buffer, int offset) {
        int pos = offset + RType.HEADER_SIZE;

        buffer.putLong(pos, imbalance.tsRecv(), ORDER);
        buffer.putLong(pos + 8, imbalance.refPrice(), ORDER);
        buffer.putLong(pos + 16, imbalance.auctionTime(), ORDER);
        buffer.putLong(pos + 24, imbalance.contBookClrPrice(), ORDER);
        buffer.putLong(pos + 32, imbalance.aucInterestClrPrice(), ORDER);
        buffer.putLong(pos + 40, imbalance.ssrFillingPrice(), ORDER);
        buffer.putLong(pos + 48, imbalance.indMatchPrice(), ORDER);
        buffer.putLong(pos + 56, imbalance.upperCollar(), ORDER);
        buffer.putLong(pos + 64, imbalance.lowerCollar(), ORDER);
        pos += 72;

        buffer.putInt(pos, (int) imbalance.pairedQty(), ORDER);
        buffer.putInt(pos + 4, (int) imbalance.totalImbalanceQty(), ORDER);
        buffer.putInt(pos + 8, (int) imbalance.marketImbalanceQty(), ORDER);
        buffer.putInt(pos + 12, (int) imbalance.unpairedQty(), ORDER);
        pos += 16;

        buffer.putByte(pos, (byte) imbalance.auctionType());
        buffer.putByte(pos + 1, (byte) imbalance.side());
        buffer.putByte(pos + 2, (byte) imbalance.auctionStatus());
        buffer.putByte(pos + 3, (byte) imbalance.freezeStatus());
        buffer.putByte(pos + 4, (byte) imbalance.numExtensions());
        buffer.putByte(pos + 5, (byte) imbalance.unpairedSide());
        buffer.putByte(pos + 6, (byte) imbalance.significantImbalance());
    }

    // ==================== Reference Data ====================

    private static void encodeInstrumentDef(InstrumentDefMsg def, MutableDirectBuffer buffer, int offset) {
        buffer.putLong(offset + InstrumentDefLayout.TS_RECV, def.tsRecv(), ORDER);
        buffer.putLong(offset + InstrumentDefLayout.MIN_PRICE_INCREMENT, def.minPriceIncrement(), ORDER);
        buffer.putLong(offset + InstrumentDefLayout.DISPLAY_FACTOR, def.displayFactor(), ORDER);
        buffer.putLong(offset + InstrumentDefLayout.EXPIRATION, def.expiration(), ORDER);
        buffer.putLong(offset + InstrumentDefLayout.ACTIVATION, def.activation(), ORDER);
        buffer.putLong(offset + InstrumentDefLayout.HIGH_LIMIT_PRICE, def.highLimitPrice(), ORDER);
        buffer.putLong(offset + InstrumentDefLayout.LOW_LIMIT_PRICE, def.lowLimitPrice(), ORDER);
        buffer.putLong(offset + InstrumentDefLayout.MAX_PRICE_VARIATION, def.maxPriceVariation(), ORDER);
        buffer.putLong(offset + InstrumentDefLayout.TRADING_REFERENCE_PRICE, def.tradingReferencePrice(), ORDER);

        CStrings.write(buffer, offset + InstrumentDefLayout.CURRENCY,
            InstrumentDefLayout.CURRENCY_WIDTH, def.currency());
        CStrings.write(buffer, offset + InstrumentDefLayout.SETTL_CURRENCY,
            InstrumentDefLayout.CURRENCY_WIDTH, def.settlCurrency());
        CStrings.write(buffer, offset + InstrumentDefLayout.SECSUBTYPE,
            InstrumentDefLayout.SECSUBTYPE_WIDTH, def.secSubType());
        CStrings.write(buffer, offset + InstrumentDefLayout.RAW_SYMBOL,
            InstrumentDefLayout.RAW_SYMBOL_WIDTH, def.rawSymbol());
        CStrings.write(buffer, offset + InstrumentDefLayout.GROUP,
            InstrumentDefLayout.GROUP_WIDTH, def.group());
        CStrings.write(buffer, offset + InstrumentDefLayout.EXCHANGE,
            InstrumentDefLayout.EXCHANGE_WIDTH, def.exchange());
        CStrings.write(buffer, offset + InstrumentDefLayout.ASSET,
            InstrumentDefLayout.ASSET_WIDTH, def.asset());
        CStrings.write(buffer, offset + InstrumentDefLayout.CFI,
            InstrumentDefLayout.CFI_WIDTH, def.cfi());
        CStrings.write(buffer, offset + InstrumentDefLayout.SECURITY_TYPE,
            InstrumentDefLayout.SECURITY_TYPE_WIDTH, def.securityType());
        CStrings.write(buffer, offset + InstrumentDefLayout.UNIT_OF_MEASURE,
            InstrumentDefLayout.UNIT_OF_MEASURE_WIDTH, def.unitOfMeasure());
        CStrings.write(buffer, offset + InstrumentDefLayout.UNDERLYING,
            InstrumentDefLayout.UNDERLYING_WIDTH, def.underlying());

        buffer.putByte(offset + InstrumentDefLayout.INSTRUMENT_CLASS, (byte) def.instrumentClass());
        buffer.putLong(offset + InstrumentDefLayout.STRIKE_PRICE, def.strikePrice(), ORDER);
        buffer.putByte(offset + InstrumentDefLayout.MATCH_ALGORITHM, (byte) def.matchAlgorithm());
    }

    private static void encodeSymbolMapping(SymbolMappingMsg mapping, MutableDirectBuffer buffer, int offset) {
        int pos = offset + RType.HEADER_SIZE;

        buffer.putByte(pos, (byte) mapping.stypeIn());
        pos += 1;
        CStrings.write(buffer, pos, SymbolMappingLayout.SYMBOL_WIDTH, mapping.stypeInSymbol());
        pos += SymbolMappingLayout.SYMBOL_WIDTH;
        buffer.putByte(pos, (byte) mapping.stypeOut());
        pos += 1;
        CStrings.write(buffer, pos, SymbolMappingLayout.SYMBOL_WIDTH, mapping.stypeOutSymbol());
        pos += SymbolMappingLayout.SYMBOL_WIDTH;
        buffer.putLong(pos, mapping.startTs(), ORDER);
        pos += 8;
        buffer.putLong(pos, mapping.endTs(), ORDER);
    }

    // ==================== Gateway Messages ====================

    private static void encodeError(ErrorMsg error, MutableDirectBuffer buffer, int offset) {
        int pos = offset + RType.HEADER_SIZE;
        CStrings.write(buffer, pos, GatewayMessageLayout.ERR_WIDTH, error.err());
        pos += GatewayMessageLayout.ERR_WIDTH;
        buffer.putByte(pos, (byte) error.code());
        buffer.putByte(pos + 1, (byte) (error.isLast() ? 1 : 0));
    }

    private static void encodeSystem(SystemMsg system, MutableDirectBuffer buffer, int offset) {
        int pos = offset + RType.HEADER_SIZE;
        CStrings.write(buffer, pos, GatewayMessageLayout.MSG_WIDTH, system.msg());
        pos += GatewayMessageLayout.MSG_WIDTH;
        buffer.putByte(pos, (byte) system.code());
    }

    // ==================== Validation ====================

    private static void checkVariant(Record record) {
        RType rtype = RType.fromCode(record.rtype());
        boolean matches = switch (rtype) {
            case MBP_0 -> record instanceof TradeMsg;
            case MBP_1 -> record instanceof Mbp1Msg;
            case MBP_10 -> record instanceof Mbp10Msg;
            case OHLCV_1S, OHLCV_1M, OHLCV_1H, OHLCV_1D, OHLCV_EOD -> record instanceof OhlcvMsg;
            case STATUS -> record instanceof StatusMsg;
            case INSTRUMENT_DEF -> record instanceof InstrumentDefMsg;
            case IMBALANCE -> record instanceof ImbalanceMsg;
            case ERROR -> record instanceof ErrorMsg;
            case SYMBOL_MAPPING -> record instanceof SymbolMappingMsg;
            case SYSTEM -> record instanceof SystemMsg;
            case STATISTICS -> record instanceof StatMsg;
            case MBO -> record instanceof MboMsg;
            case CMBP_1 -> record instanceof Cmbp1Msg;
            case CBBO_1S, CBBO_1M, TCBBO -> record instanceof CbboMsg;
            case BBO_1S, BBO_1M -> record instanceof BboMsg;
        };
        if (!matches) {
            throw new IllegalArgumentException("rtype " + rtype + " does not match "
                + record.getClass().getSimpleName());
        }
    }
}
