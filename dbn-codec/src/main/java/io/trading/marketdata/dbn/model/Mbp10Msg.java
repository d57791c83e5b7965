package io.trading.marketdata.dbn.model;

import java.util.List;

/**
 * Market-by-price event with the top ten book levels.
 */
public record Mbp10Msg(
    RecordHeader header,
    long price,
    long size,
    char action,
    char side,
    int flags,
    int depth,
    long tsRecv,
    int tsInDelta,
    long sequence,
    List<BidAskPair> levels
) implements Record {

    public static final int LEVEL_COUNT = 10;

    public Mbp10Msg {
        if (header == null) {
            throw new IllegalArgumentException("header cannot be null");
        }
        if (levels == null || levels.size() != LEVEL_COUNT) {
            throw new IllegalArgumentException("levels must contain exactly " + LEVEL_COUNT + " entries");
        }
        levels = List.copyOf(levels);
    }
}
