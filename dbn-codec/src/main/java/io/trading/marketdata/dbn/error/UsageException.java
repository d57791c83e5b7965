package io.trading.marketdata.dbn.error;

/**
 * Invalid use of an API: an illegal state transition such as a second start,
 * an operation after close, or a malformed request.
 */
public class UsageException extends FeedException {

    public UsageException(String message) {
        super(message);
    }

    public UsageException(String message, Throwable cause) {
        super(message, cause);
    }
}
