package io.trading.marketdata.dbn.error;

/**
 * A requested resource (file, symbol) does not exist.
 */
public class NotFoundException extends FeedException {

    public NotFoundException(String message) {
        super(message);
    }
}
