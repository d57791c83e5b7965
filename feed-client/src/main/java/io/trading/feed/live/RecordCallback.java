package io.trading.feed.live;

import io.trading.feed.api.KeepGoing;
import io.trading.marketdata.dbn.codec.RawRecord;

/**
 * Receives raw records from a live transport. May be invoked on any thread.
 *
 * <p>The raw record aliases the transport's buffer and is only valid until this method returns.
 */
@FunctionalInterface
public interface RecordCallback {

    /**
     * @return {@link KeepGoing#STOP} to ask the transport to stop delivering
     */
    KeepGoing onRecord(RawRecord record);
}
