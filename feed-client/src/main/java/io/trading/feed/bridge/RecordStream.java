package io.trading.feed.bridge;

import io.trading.marketdata.dbn.error.CancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Turns records pushed from arbitrary producer threads into an ordered, cancellable sequence
 * pulled by a single consumer.
 *
 * <p>Records are delivered in offer order. Completion and failure are terminal states held
 * outside the queue, so queued records always drain before the end or the error is seen.
 *
 * @param <T> record type
 */
public final class RecordStream<T> implements RecordSink<T>, Iterable<T>, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecordStream.class);

    private final String name;
    private final int capacity;
    private final BackpressurePolicy policy;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition notFull = lock.newCondition();
    private final ArrayDeque<T> queue = new ArrayDeque<>();

    // guarded by lock
    private boolean writerClosed;
    private RuntimeException failure;
    private boolean failureDelivered;

    private volatile boolean cancelled;
    private volatile Runnable cancelHook;
    private volatile Executor cancelExecutor;

    public RecordStream(String name, int capacity, BackpressurePolicy policy) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        this.name = name;
        this.capacity = capacity;
        this.policy = policy;
    }

    // ==================== Producer Side ====================

    @Override
    public boolean offer(T record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        lock.lock();
        try {
            while (!cancelled && !writerClosed && policy == BackpressurePolicy.BLOCK && queue.size() >= capacity) {
                notFull.await();
            }
            if (cancelled || writerClosed) {
                return false;
            }
            queue.addLast(record);
            notEmpty.signal();
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancelledException("[" + name + "] Interrupted while waiting for queue space", e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void complete() {
        lock.lock();
        try {
            writerClosed = true;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void fail(RuntimeException cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        lock.lock();
        try {
            if (writerClosed) {
                LOGGER.debug("[{}] Ignoring failure after stream closed: {}", name, cause.toString());
                return;
            }
            writerClosed = true;
            failure = cause;
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Registers the action to run on {@code executor} when the consumer cancels, so neither the
     * cancelling thread nor a producer blocked in {@link #offer} runs it.
     */
    public void onCancel(Runnable hook, Executor executor) {
        if (hook == null || executor == null) {
            throw new IllegalArgumentException("hook and executor cannot be null");
        }
        this.cancelExecutor = executor;
        this.cancelHook = hook;
    }

    // ==================== Consumer Side ====================

    /**
     * Waits for the next record.
     *
     * @return the next record, or null once the stream has ended or was cancelled
     * @throws RuntimeException    the failure the producer closed the stream with, exactly once
     * @throws CancelledException  if the waiting thread is interrupted; the stream is cancelled
     */
    public T take() {
        lock.lock();
        try {
            while (true) {
                if (cancelled) {
                    return null;
                }
                T record = queue.pollFirst();
                if (record != null) {
                    notFull.signal();
                    return record;
                }
                if (writerClosed) {
                    return terminal();
                }
                notEmpty.await();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            throw new CancelledException("[" + name + "] Interrupted while waiting for a record", e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * As {@link #take()} but gives up after {@code timeout}.
     *
     * @return the next record, or null when the stream ended, was cancelled or the timeout elapsed;
     *         use {@link #isFinished()} to tell them apart
     */
    public T poll(long timeout, TimeUnit unit) {
        long remaining = unit.toNanos(timeout);
        lock.lock();
        try {
            while (true) {
                if (cancelled) {
                    return null;
                }
                T record = queue.pollFirst();
                if (record != null) {
                    notFull.signal();
                    return record;
                }
                if (writerClosed) {
                    return terminal();
                }
                if (remaining <= 0) {
                    return null;
                }
                remaining = notEmpty.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel();
            throw new CancelledException("[" + name + "] Interrupted while waiting for a record", e);
        } finally {
            lock.unlock();
        }
    }

    private T terminal() {
        if (failure != null && !failureDelivered) {
            failureDelivered = true;
            throw failure;
        }
        return null;
    }

    /**
     * Stops delivery. Pending and future records are discarded and blocked producers are released.
     * Idempotent.
     */
    public void cancel() {
        lock.lock();
        try {
            if (cancelled) {
                return;
            }
            cancelled = true;
            queue.clear();
            notEmpty.signalAll();
            notFull.signalAll();
        } finally {
            lock.unlock();
        }
        LOGGER.debug("[{}] Record stream cancelled", name);
        runCancelHook();
    }

    private void runCancelHook() {
        Runnable hook = cancelHook;
        if (hook == null) {
            return;
        }
        try {
            cancelExecutor.execute(() -> {
                try {
                    hook.run();
                } catch (RuntimeException e) {
                    LOGGER.error("[{}] Cancel hook failed", name, e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOGGER.warn("[{}] Cancel hook rejected; its executor is shut down", name);
        }
    }

    /**
     * True once no further records will be delivered to the consumer.
     */
    public boolean isFinished() {
        lock.lock();
        try {
            return cancelled || (writerClosed && queue.isEmpty() && (failure == null || failureDelivered));
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosedForWriting() {
        lock.lock();
        try {
            return writerClosed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of records waiting to be consumed.
     */
    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return policy == BackpressurePolicy.UNBOUNDED ? Integer.MAX_VALUE : capacity;
    }

    public String name() {
        return name;
    }

    // ==================== Adapters ====================

    /**
     * Blocking iterator over the remaining records. Intended for a single consumer thread.
     */
    @Override
    public Iterator<T> iterator() {
        return new Iterator<>() {
            private T next;

            @Override
            public boolean hasNext() {
                if (next == null) {
                    next = take();
                }
                return next != null;
            }

            @Override
            public T next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                T record = next;
                next = null;
                return record;
            }
        };
    }

    /**
     * Sequential stream over the remaining records. Closing the stream cancels this record stream.
     */
    public Stream<T> stream() {
        Spliterator<T> spliterator = Spliterators.spliteratorUnknownSize(
            iterator(), Spliterator.ORDERED | Spliterator.NONNULL);
        return StreamSupport.stream(spliterator, false).onClose(this::cancel);
    }

    /**
     * Cancels the stream.
     */
    @Override
    public void close() {
        cancel();
    }
}
