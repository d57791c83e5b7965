package io.trading.feed.bridge;

import io.trading.marketdata.dbn.error.CancelledException;
import io.trading.marketdata.dbn.error.TransportException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RecordStream.
 */
class RecordStreamTest {

    @Test
    void testDeliversInOfferOrderThenEnds() {
        RecordStream<Integer> stream = new RecordStream<>("test", 16, BackpressurePolicy.BLOCK);
        for (int i = 0; i < 10; i++) {
            assertTrue(stream.offer(i));
        }
        stream.complete();

        List<Integer> received = new ArrayList<>();
        for (Integer value : stream) {
            received.add(value);
        }

        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), received);
        assertTrue(stream.isFinished());
        assertNull(stream.take());
    }

    @Test
    void testOrderPreservedAcrossThreads() throws InterruptedException {
        RecordStream<Integer> stream = new RecordStream<>("test", 8, BackpressurePolicy.BLOCK);
        Thread producer = new Thread(() -> {
            for (int i = 0; i < 1_000; i++) {
                stream.offer(i);
            }
            stream.complete();
        });
        producer.start();

        List<Integer> received = stream.stream().collect(Collectors.toList());
        producer.join();

        assertEquals(1_000, received.size());
        for (int i = 0; i < received.size(); i++) {
            assertEquals(i, received.get(i));
        }
    }

    @Test
    void testFailureDeliveredOnceAfterQueuedRecords() {
        RecordStream<String> stream = new RecordStream<>("test", 16, BackpressurePolicy.BLOCK);
        stream.offer("a");
        stream.offer("b");
        stream.fail(new TransportException("connection reset"));

        assertEquals("a", stream.take());
        assertEquals("b", stream.take());
        TransportException error = assertThrows(TransportException.class, stream::take);
        assertEquals("connection reset", error.getMessage());
        assertNull(stream.take());
        assertTrue(stream.isFinished());
    }

    @Test
    void testOfferAfterCompleteIsRefused() {
        RecordStream<String> stream = new RecordStream<>("test", 4, BackpressurePolicy.BLOCK);
        stream.complete();

        assertFalse(stream.offer("late"));
        assertTrue(stream.isClosedForWriting());
    }

    @Test
    void testFailAfterCompleteIsIgnored() {
        RecordStream<String> stream = new RecordStream<>("test", 4, BackpressurePolicy.BLOCK);
        stream.complete();
        stream.fail(new TransportException("too late"));

        assertNull(stream.take());
    }

    @Test
    void testCancelDiscardsQueuedRecordsAndRunsHook() throws InterruptedException {
        RecordStream<String> stream = new RecordStream<>("test", 4, BackpressurePolicy.BLOCK);
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "cancel-hook"));
        CountDownLatch hookRan = new CountDownLatch(1);
        AtomicReference<String> hookThread = new AtomicReference<>();
        stream.onCancel(() -> {
            hookThread.set(Thread.currentThread().getName());
            hookRan.countDown();
        }, executor);
        stream.offer("a");

        stream.cancel();

        assertTrue(stream.isCancelled());
        assertNull(stream.take());
        assertFalse(stream.offer("b"));
        assertTrue(hookRan.await(5, TimeUnit.SECONDS));
        assertEquals("cancel-hook", hookThread.get());
        executor.shutdown();
    }

    @Test
    void testCancelWithShutDownHookExecutor() {
        RecordStream<String> stream = new RecordStream<>("test", 4, BackpressurePolicy.BLOCK);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        executor.shutdown();
        stream.onCancel(() -> fail("hook must not run"), executor);

        stream.cancel();

        assertTrue(stream.isCancelled());
        assertThrows(IllegalArgumentException.class, () -> stream.onCancel(null, executor));
    }

    @Test
    void testBlockPolicyWaitsForSpace() throws InterruptedException {
        RecordStream<Integer> stream = new RecordStream<>("test", 2, BackpressurePolicy.BLOCK);
        stream.offer(1);
        stream.offer(2);

        AtomicBoolean thirdOffered = new AtomicBoolean();
        Thread producer = new Thread(() -> thirdOffered.set(stream.offer(3)));
        producer.start();

        Thread.sleep(100);
        assertFalse(thirdOffered.get());
        assertEquals(2, stream.size());

        assertEquals(1, stream.take());
        producer.join(5_000);
        assertTrue(thirdOffered.get());
        assertEquals(2, stream.take());
        assertEquals(3, stream.take());
    }

    @Test
    void testUnboundedPolicyNeverBlocks() {
        RecordStream<Integer> stream = new RecordStream<>("test", 2, BackpressurePolicy.UNBOUNDED);
        for (int i = 0; i < 100; i++) {
            assertTrue(stream.offer(i));
        }

        assertEquals(100, stream.size());
    }

    @Test
    void testCompleteReleasesBlockedProducer() throws InterruptedException {
        RecordStream<Integer> stream = new RecordStream<>("test", 1, BackpressurePolicy.BLOCK);
        stream.offer(1);
        AtomicReference<Boolean> result = new AtomicReference<>();
        Thread producer = new Thread(() -> result.set(stream.offer(2)));
        producer.start();

        Thread.sleep(50);
        stream.complete();
        producer.join(5_000);

        assertEquals(Boolean.FALSE, result.get());
        assertEquals(1, stream.take());
        assertNull(stream.take());
    }

    @Test
    void testInterruptedConsumerCancelsStream() throws InterruptedException {
        RecordStream<Integer> stream = new RecordStream<>("test", 4, BackpressurePolicy.BLOCK);
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread consumer = new Thread(() -> {
            try {
                stream.take();
            } catch (Throwable t) {
                thrown.set(t);
            }
        });
        consumer.start();

        Thread.sleep(50);
        consumer.interrupt();
        consumer.join(5_000);

        assertInstanceOf(CancelledException.class, thrown.get());
        assertTrue(stream.isCancelled());
    }

    @Test
    void testPollTimesOut() {
        RecordStream<Integer> stream = new RecordStream<>("test", 4, BackpressurePolicy.BLOCK);

        assertNull(stream.poll(10, TimeUnit.MILLISECONDS));
        assertFalse(stream.isFinished());
    }

    @Test
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class,
            () -> new RecordStream<Integer>("test", 0, BackpressurePolicy.BLOCK));
    }

    @Test
    void testBackpressurePolicyFromString() {
        assertEquals(BackpressurePolicy.BLOCK, BackpressurePolicy.fromString("block"));
        assertEquals(BackpressurePolicy.UNBOUNDED, BackpressurePolicy.fromString("UNBOUNDED"));
        assertThrows(IllegalArgumentException.class, () -> BackpressurePolicy.fromString("drop"));
    }
}
