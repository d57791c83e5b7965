package io.trading.feed.bridge;

import java.util.Locale;

/**
 * What a producer does when the record queue is full.
 */
public enum BackpressurePolicy {
    /** Bounded queue; the producer blocks until the consumer makes room or the stream is cancelled. */
    BLOCK,
    /** Unbounded queue; the producer never blocks and memory grows with consumer lag. */
    UNBOUNDED;

    public static BackpressurePolicy fromString(String value) {
        return BackpressurePolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
