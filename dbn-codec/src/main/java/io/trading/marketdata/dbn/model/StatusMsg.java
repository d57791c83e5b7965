package io.trading.marketdata.dbn.model;

/**
 * Trading status update for an instrument. The boolean-like fields hold
 * {@code 'Y'}, {@code 'N'} or {@code '~'} for not available.
 */
public record StatusMsg(
    RecordHeader header,
    long tsRecv,
    int action,
    int reason,
    int tradingEvent,
    char isTrading,
    char isQuoting,
    char isShortSellRestricted
) implements Record {
    public StatusMsg {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
    }
}
