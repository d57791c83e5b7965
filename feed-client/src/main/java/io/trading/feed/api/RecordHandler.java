package io.trading.feed.api;

import io.trading.marketdata.dbn.model.Record;

/**
 * Receives decoded records during a replay.
 */
@FunctionalInterface
public interface RecordHandler {

    KeepGoing onRecord(Record record);
}
