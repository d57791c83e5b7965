package io.trading.marketdata.dbn.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Conversions for unsigned 64-bit nanosecond timestamps since the Unix epoch.
 */
public final class UnixNanos {

    /** Sentinel for a null or undefined timestamp (all bits set). */
    public static final long UNDEF_TIMESTAMP = -1L;

    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private UnixNanos() {}

    public static boolean isDefined(long nanos) {
        return nanos != UNDEF_TIMESTAMP;
    }

    /**
     * Converts to an instant, or empty for the undefined sentinel.
     */
    public static Optional<Instant> toInstant(long nanos) {
        if (nanos == UNDEF_TIMESTAMP) {
            return Optional.empty();
        }
        long seconds = Long.divideUnsigned(nanos, NANOS_PER_SECOND);
        long remainder = Long.remainderUnsigned(nanos, NANOS_PER_SECOND);
        return Optional.of(Instant.ofEpochSecond(seconds, remainder));
    }

    /**
     * UTC calendar date of a timestamp, or empty for the undefined sentinel.
     */
    public static Optional<LocalDate> toUtcDate(long nanos) {
        return toInstant(nanos).map(instant -> LocalDate.ofInstant(instant, ZoneOffset.UTC));
    }

    public static long fromInstant(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
    }
}
