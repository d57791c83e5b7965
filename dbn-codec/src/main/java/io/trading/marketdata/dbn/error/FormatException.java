package io.trading.marketdata.dbn.error;

/**
 * Raised when a DBN metadata header cannot be parsed.
 */
public class FormatException extends FeedException {

    public FormatException(String message) {
        super(message);
    }

    public FormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
