package io.trading.marketdata.dbn.model;

/**
 * Error reported by the live gateway.
 */
public record ErrorMsg(
    RecordHeader header,
    String err,
    int code,
    boolean isLast
) implements Record {
    public ErrorMsg {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
        if (err == null) {
            throw new IllegalArgumentException("err cannot be null");
        }
    }
}
