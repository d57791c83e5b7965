package io.trading.feed.bridge;

/**
 * Producer-side view of a {@link RecordStream}. All methods may be called from any thread.
 *
 * @param <T> record type
 */
public interface RecordSink<T> {

    /**
     * Enqueues a record, blocking while a bounded queue is full.
     *
     * @return false if the stream was cancelled or already closed for writing; the record is dropped
     */
    boolean offer(T record);

    /**
     * Closes the stream for writing. The consumer sees the end once queued records are drained.
     */
    void complete();

    /**
     * Closes the stream for writing with an error. Queued records are delivered first, then the
     * consumer receives {@code cause} once.
     */
    void fail(RuntimeException cause);

    boolean isCancelled();
}
