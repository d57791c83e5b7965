package io.trading.marketdata.dbn.error;

/**
 * Failure surfaced by the live transport. Terminal to the record stream it occurs on.
 */
public class TransportException extends FeedException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
