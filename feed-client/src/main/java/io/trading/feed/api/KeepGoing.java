package io.trading.feed.api;

/**
 * Returned by record callbacks to tell the producer whether to keep delivering.
 */
public enum KeepGoing {
    CONTINUE,
    STOP
}
