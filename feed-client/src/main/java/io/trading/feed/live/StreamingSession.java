package io.trading.feed.live;

import io.trading.feed.api.KeepGoing;
import io.trading.feed.bridge.RecordStream;
import io.trading.feed.config.DecodeMode;
import io.trading.feed.metrics.FeedMetrics;
import io.trading.marketdata.dbn.codec.DbnRecordDecoder;
import io.trading.marketdata.dbn.codec.RawRecord;
import io.trading.marketdata.dbn.error.DecodeException;
import io.trading.marketdata.dbn.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * State of one start-to-stop span of a live session: the record stream being fed, the
 * lifecycle flag every callback checks, and the count of callbacks currently running.
 */
final class StreamingSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamingSession.class);

    enum Lifecycle {
        ACTIVE,
        STOPPING,
        STOPPED
    }

    private final long id;
    private final String name;
    private final RecordStream<Record> stream;
    private final DecodeMode decodeMode;
    private final FeedMetrics metrics;
    private final Runnable onDecodeFailure;

    private final AtomicReference<Lifecycle> lifecycle = new AtomicReference<>(Lifecycle.ACTIVE);
    private final ReentrantLock inFlightLock = new ReentrantLock();
    private final Condition quiescent = inFlightLock.newCondition();
    private int inFlight;
    private Runnable releaseAction;

    StreamingSession(long id, String name, RecordStream<Record> stream, DecodeMode decodeMode,
                     FeedMetrics metrics, Runnable onDecodeFailure) {
        this.id = id;
        this.name = name;
        this.stream = stream;
        this.decodeMode = decodeMode;
        this.metrics = metrics;
        this.onDecodeFailure = onDecodeFailure;
    }

    long id() {
        return id;
    }

    RecordStream<Record> stream() {
        return stream;
    }

    Lifecycle lifecycle() {
        return lifecycle.get();
    }

    boolean isActive() {
        return lifecycle.get() == Lifecycle.ACTIVE;
    }

    // ==================== Producer Callback ====================

    /**
     * Transport callback. The in-flight count is raised before the lifecycle flag is read, so
     * a teardown that has set the flag and then observed zero in flight cannot be overtaken.
     */
    KeepGoing onRecord(RawRecord raw) {
        enter();
        try {
            if (lifecycle.get() != Lifecycle.ACTIVE) {
                metrics.recordCallbackRejected(name);
                return KeepGoing.STOP;
            }
            metrics.recordReceived(name, raw.rtype());

            RawRecord detached = raw.isDetached() ? raw : raw.copy();
            Record record;
            long startNanos = System.nanoTime();
            try {
                record = DbnRecordDecoder.decode(detached);
            } catch (DecodeException e) {
                return onDecodeError(e);
            }
            metrics.recordDecodeLatency(name, System.nanoTime() - startNanos);

            if (!stream.offer(record)) {
                return KeepGoing.STOP;
            }
            metrics.recordDecoded(name, record.rtype());
            metrics.setQueueDepth(name, stream.size());
            return KeepGoing.CONTINUE;
        } finally {
            exit();
        }
    }

    private KeepGoing onDecodeError(DecodeException e) {
        metrics.recordDecodeError(name);
        if (decodeMode == DecodeMode.LENIENT) {
            metrics.recordSkipped(name);
            LOGGER.warn("[{}] Skipping undecodable record (rtype=0x{}, length={}): {}",
                name, Integer.toHexString(e.getRtype()), e.getLength(), e.getMessage());
            return KeepGoing.CONTINUE;
        }
        LOGGER.error("[{}] Undecodable record, terminating stream: {}", name, e.getMessage());
        stream.fail(e);
        onDecodeFailure.run();
        return KeepGoing.STOP;
    }

    private void enter() {
        inFlightLock.lock();
        try {
            inFlight++;
        } finally {
            inFlightLock.unlock();
        }
    }

    private void exit() {
        Runnable release = null;
        inFlightLock.lock();
        try {
            inFlight--;
            if (inFlight == 0) {
                quiescent.signalAll();
                if (releaseAction != null && lifecycle.get() != Lifecycle.ACTIVE) {
                    release = releaseAction;
                    releaseAction = null;
                }
            }
        } finally {
            inFlightLock.unlock();
        }
        if (release != null) {
            release.run();
        }
    }

    // ==================== Teardown ====================

    /**
     * Moves ACTIVE to STOPPING. Every callback entering after this returns STOP.
     *
     * @return false if teardown had already begun
     */
    boolean beginStop() {
        return lifecycle.compareAndSet(Lifecycle.ACTIVE, Lifecycle.STOPPING);
    }

    /**
     * Waits until no callback is running.
     *
     * @return false if the timeout elapsed first
     */
    boolean awaitQuiescence(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        inFlightLock.lock();
        try {
            while (inFlight > 0) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = quiescent.awaitNanos(remaining);
            }
            return true;
        } finally {
            inFlightLock.unlock();
        }
    }

    /**
     * Runs {@code action} as soon as no callback is running, immediately if none is.
     */
    void releaseWhenQuiescent(Runnable action) {
        boolean runNow;
        inFlightLock.lock();
        try {
            runNow = inFlight == 0;
            if (!runNow) {
                releaseAction = action;
            }
        } finally {
            inFlightLock.unlock();
        }
        if (runNow) {
            action.run();
        }
    }

    void markStopped() {
        lifecycle.set(Lifecycle.STOPPED);
    }

    int inFlight() {
        inFlightLock.lock();
        try {
            return inFlight;
        } finally {
            inFlightLock.unlock();
        }
    }
}
