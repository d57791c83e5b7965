package io.trading.marketdata.dbn.model;

/**
 * Non-error gateway message, such as a heartbeat or subscription acknowledgement.
 */
public record SystemMsg(
    RecordHeader header,
    String msg,
    int code
) implements Record {
    public SystemMsg {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
        if (msg == null) {
            throw new IllegalArgumentException("msg cannot be null");
        }
    }

    public boolean isHeartbeat() {
        return msg.startsWith("Heartbeat");
    }
}
