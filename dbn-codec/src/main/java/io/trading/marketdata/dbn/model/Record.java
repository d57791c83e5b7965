package io.trading.marketdata.dbn.model;

/**
 * A decoded DBN record. Every variant is an immutable value carrying the common header.
 */
public sealed interface Record permits
    TradeMsg, MboMsg, Mbp1Msg, Mbp10Msg, OhlcvMsg, StatusMsg, InstrumentDefMsg,
    ImbalanceMsg, ErrorMsg, SymbolMappingMsg, SystemMsg, StatMsg, BboMsg, CbboMsg,
    Cmbp1Msg, UnknownRecord {

    RecordHeader header();

    default int rtype() {
        return header().rtype();
    }

    default int publisherId() {
        return header().publisherId();
    }

    default long instrumentId() {
        return header().instrumentId();
    }

    default long tsEvent() {
        return header().tsEvent();
    }
}
