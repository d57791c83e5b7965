package io.trading.marketdata.dbn.error;

/**
 * Raised to a consumer whose wait on a record stream was cancelled.
 */
public class CancelledException extends FeedException {

    public CancelledException(String message) {
        super(message);
    }

    public CancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
