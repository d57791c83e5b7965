package io.trading.marketdata.dbn.error;

/**
 * Base type for every failure raised by the DBN codec and the feed client.
 * All subtypes are unchecked.
 */
public abstract class FeedException extends RuntimeException {

    protected FeedException(String message) {
        super(message);
    }

    protected FeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
