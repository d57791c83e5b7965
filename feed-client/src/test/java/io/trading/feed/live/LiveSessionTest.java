package io.trading.feed.live;

import io.prometheus.client.CollectorRegistry;
import io.trading.feed.api.KeepGoing;
import io.trading.feed.bridge.RecordStream;
import io.trading.feed.config.DecodeMode;
import io.trading.feed.config.FeedClientConfig;
import io.trading.feed.metrics.FeedMetrics;
import io.trading.marketdata.dbn.codec.DbnRecordEncoder;
import io.trading.marketdata.dbn.error.DecodeException;
import io.trading.marketdata.dbn.error.TransportException;
import io.trading.marketdata.dbn.error.UsageException;
import io.trading.marketdata.dbn.model.RType;
import io.trading.marketdata.dbn.model.Record;
import io.trading.marketdata.dbn.model.RecordHeader;
import io.trading.marketdata.dbn.model.Schema;
import io.trading.marketdata.dbn.model.TradeMsg;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LiveSession against a scripted transport.
 */
class LiveSessionTest {

    private static final String DATASET = "XNAS.ITCH";

    private FakeTransport transport;
    private FeedMetrics metrics;
    private LiveSession session;
    private final List<ConnectionState> transitions = new CopyOnWriteArrayList<>();
    private final List<Throwable> errors = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        transport = new FakeTransport();
        metrics = new FeedMetrics(new CollectorRegistry());
        session = newSession(config(DecodeMode.STRICT, 4, 1_000), metrics);
    }

    @AfterEach
    void tearDown() {
        session.close();
    }

    private LiveSession newSession(FeedClientConfig config, FeedMetrics sessionMetrics) {
        LiveSession live = new LiveSession(transport, config, sessionMetrics);
        live.addListener(new SessionListener() {
            @Override
            public void onStateChanged(ConnectionState previous, ConnectionState current) {
                transitions.add(current);
            }

            @Override
            public void onError(Throwable error) {
                errors.add(error);
            }
        });
        return live;
    }

    private static FeedClientConfig config(DecodeMode decodeMode, int capacity, long quiescenceTimeoutMs) {
        return FeedClientConfig.builder()
            .sessionName("test")
            .decodeMode(decodeMode)
            .queueCapacity(capacity)
            .quiescenceTimeoutMs(quiescenceTimeoutMs)
            .build();
    }

    private static byte[] trade(long sequence) {
        return DbnRecordEncoder.encode(new TradeMsg(RecordHeader.of(RType.MBP_0, 1, 11667, 1_000L + sequence),
            490_050_000_000L, 100, 'T', 'B', 0x80, 0, 2_000L + sequence, 0, sequence));
    }

    private static byte[] truncatedTrade() {
        byte[] bytes = new byte[20];
        bytes[0] = 5;
        bytes[1] = (byte) RType.MBP_0.code();
        return bytes;
    }

    private static void awaitState(LiveSession live, ConnectionState expected) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (live.getState() != expected && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(expected, live.getState());
    }

    private void subscribeAndStart() {
        session.subscribe(DATASET, Schema.TRADES, List.of("NVDA"));
        session.start();
    }

    // ==================== State Machine ====================

    @Test
    void testStartAndStopTransitions() {
        assertEquals(ConnectionState.DISCONNECTED, session.getState());

        subscribeAndStart();
        assertEquals(ConnectionState.STREAMING, session.getState());

        session.stop();
        assertEquals(ConnectionState.STOPPED, session.getState());
        assertEquals(List.of(ConnectionState.CONNECTING, ConnectionState.CONNECTED,
            ConnectionState.STREAMING, ConnectionState.STOPPED), transitions);
        assertEquals(ConnectionState.STOPPED.ordinal(), metrics.getConnectionState("test"));
    }

    @Test
    void testDoubleStartRejected() {
        subscribeAndStart();

        assertThrows(UsageException.class, session::start);
        assertEquals(1, transport.startCalls.get());
    }

    @Test
    void testStartWithoutSubscriptionRejected() {
        assertThrows(UsageException.class, session::start);
        assertEquals(0, transport.startCalls.get());
    }

    @Test
    void testStopIsIdempotent() {
        subscribeAndStart();

        session.stop();
        session.stop();

        assertEquals(ConnectionState.STOPPED, session.getState());
        assertEquals(1, transport.stopCalls.get());
    }

    @Test
    void testRestartCreatesFreshStream() {
        subscribeAndStart();
        RecordStream<Record> first = session.records();
        session.stop();

        session.start();

        assertNotSame(first, session.records());
        assertTrue(first.isClosedForWriting());
        assertEquals(ConnectionState.STREAMING, session.getState());
    }

    @Test
    void testRecordsBeforeStartRejected() {
        assertThrows(UsageException.class, session::records);
    }

    // ==================== Subscriptions ====================

    @Test
    void testSubscribeValidation() {
        assertThrows(UsageException.class, () -> session.subscribe(DATASET, Schema.TRADES, List.of()));
        assertThrows(UsageException.class, () -> session.subscribe("", Schema.TRADES, List.of("NVDA")));
        assertThrows(UsageException.class, () -> session.subscribe(DATASET, null, List.of("NVDA")));
        assertThrows(UsageException.class, () -> session.subscribe(DATASET, Schema.TRADES, List.of(" ")));
        assertThrows(UsageException.class, () -> session.subscribe(DATASET, Schema.TRADES, List.of("NV|DA")));
        assertThrows(UsageException.class, () -> session.subscribe(DATASET, Schema.TRADES, List.of("NV\nDA")));
        assertTrue(transport.subscribeCalls.isEmpty());
    }

    @Test
    void testSubscribeWhileStreamingRejected() {
        subscribeAndStart();

        assertThrows(UsageException.class,
            () -> session.subscribe(DATASET, Schema.MBO, List.of("AAPL")));
    }

    @Test
    void testSubscribeWithSnapshot() {
        session.subscribeWithSnapshot(DATASET, Schema.MBO, List.of("NVDA", "AAPL"));

        Subscription sent = transport.subscribeCalls.get(0);
        assertTrue(sent.snapshot());
        assertEquals(List.of("NVDA", "AAPL"), sent.symbols());
    }

    @Test
    void testResubscribeReissuesInOriginalOrder() {
        session.subscribe(DATASET, Schema.TRADES, List.of("NVDA"));
        session.subscribe(DATASET, Schema.MBP_1, List.of("AAPL"));
        session.subscribe("GLBX.MDP3", Schema.OHLCV_1S, List.of("ESZ4"));

        session.reconnect();
        transport.subscribeCalls.clear();
        session.resubscribe();

        assertEquals(session.getSubscriptions(), transport.subscribeCalls);
        assertEquals(List.of(Schema.TRADES, Schema.MBP_1, Schema.OHLCV_1S),
            transport.subscribeCalls.stream().map(Subscription::schema).toList());
    }

    // ==================== Records ====================

    @Test
    void testRecordsFlowInOrder() throws InterruptedException {
        subscribeAndStart();

        Thread producer = transport.deliverAsync(trade(1), trade(2), trade(3));
        RecordStream<Record> records = session.records();
        TradeMsg first = (TradeMsg) records.take();
        TradeMsg second = (TradeMsg) records.take();
        TradeMsg third = (TradeMsg) records.take();
        producer.join(5_000);
        session.stop();

        assertEquals(1, first.sequence());
        assertEquals(2, second.sequence());
        assertEquals(3, third.sequence());
        assertNull(records.take());
        assertEquals(3.0, metrics.getRecordsDecoded("test", RType.MBP_0.code()));
    }

    @Test
    void testCallbackAfterStopIsRejected() throws InterruptedException {
        subscribeAndStart();
        RecordStream<Record> records = session.records();
        Thread producer = transport.deliverAsync(trade(1));
        producer.join(5_000);

        session.stop();
        assertEquals(0, session.registeredCallbacks());

        Thread late = transport.deliverAsync(trade(2));
        late.join(5_000);

        assertEquals(List.of(KeepGoing.CONTINUE, KeepGoing.STOP), transport.results);
        assertEquals(1.0, metrics.getCallbacksRejected("test"));
        assertEquals(1, ((TradeMsg) records.take()).sequence());
        assertNull(records.take());
    }

    @Test
    void testStopReleasesProducerBlockedOnFullQueue() throws InterruptedException {
        session.close();
        session = newSession(config(DecodeMode.STRICT, 1, 5_000), metrics);
        subscribeAndStart();

        Thread producer = transport.deliverAsync(trade(1), trade(2), trade(3));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (session.records().size() < 1 && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        Thread.sleep(50);

        long stopStarted = System.nanoTime();
        session.stop();
        long stopMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - stopStarted);
        producer.join(5_000);

        assertFalse(transport.producerAliveAfterStop);
        assertTrue(stopMillis < 2_000, "stop took " + stopMillis + " ms");
        assertFalse(producer.isAlive());
        assertEquals(ConnectionState.STOPPED, session.getState());
        assertEquals(0, session.registeredCallbacks());
        assertEquals(0.0, metrics.getQuiescenceTimeouts("test"));
        assertEquals(KeepGoing.STOP, transport.results.get(transport.results.size() - 1));
        assertEquals(1, ((TradeMsg) session.records().take()).sequence());
        assertNull(session.records().take());
    }

    @Test
    void testQuiescenceTimeoutKeepsRegistrationUntilCallbackExits() throws InterruptedException {
        BlockingMetrics blocking = new BlockingMetrics();
        session.close();
        session = newSession(config(DecodeMode.STRICT, 4, 100), blocking);
        transport.stopJoinMillis = 50;
        subscribeAndStart();

        Thread producer = transport.deliverAsync(trade(1));
        assertTrue(blocking.entered.await(5, TimeUnit.SECONDS));

        session.stop();

        assertEquals(ConnectionState.STOPPED, session.getState());
        assertEquals(1.0, blocking.getQuiescenceTimeouts("test"));
        assertEquals(1, session.registeredCallbacks());
        assertTrue(transport.producerAliveAfterStop);

        blocking.release.countDown();
        producer.join(5_000);

        assertEquals(0, session.registeredCallbacks());
        assertEquals(List.of(KeepGoing.STOP), transport.results);
        assertNull(session.records().take());
    }

    // ==================== Errors ====================

    @Test
    void testStrictDecodeErrorTerminatesStream() throws InterruptedException {
        subscribeAndStart();

        transport.deliverAsync(trade(1), truncatedTrade(), trade(3)).join(5_000);

        RecordStream<Record> records = session.records();
        assertEquals(1, ((TradeMsg) records.take()).sequence());
        DecodeException error = assertThrows(DecodeException.class, records::take);
        assertEquals(RType.MBP_0.code(), error.getRtype());
        assertNull(records.take());
        assertEquals(List.of(KeepGoing.CONTINUE, KeepGoing.STOP), transport.results);
        awaitState(session, ConnectionState.STOPPED);
        assertEquals(1.0, metrics.getDecodeErrors("test"));
    }

    @Test
    void testLenientDecodeErrorSkipsRecord() throws InterruptedException {
        session.close();
        session = newSession(config(DecodeMode.LENIENT, 4, 1_000), metrics);
        subscribeAndStart();

        transport.deliverAsync(trade(1), truncatedTrade(), trade(3)).join(5_000);
        session.stop();

        RecordStream<Record> records = session.records();
        assertEquals(1, ((TradeMsg) records.take()).sequence());
        assertEquals(3, ((TradeMsg) records.take()).sequence());
        assertNull(records.take());
        assertEquals(1.0, metrics.getRecordsSkipped("test"));
        assertEquals(1.0, metrics.getDecodeErrors("test"));
    }

    @Test
    void testTransportErrorFailsStreamAndDisconnects() throws InterruptedException {
        subscribeAndStart();
        RecordStream<Record> records = session.records();

        transport.failAsync(new IOException("connection reset")).join(5_000);

        TransportException error = assertThrows(TransportException.class, records::take);
        assertInstanceOf(IOException.class, error.getCause());
        assertEquals(ConnectionState.DISCONNECTED, session.getState());
        assertEquals(1, errors.size());

        session.stop();
        assertEquals(ConnectionState.STOPPED, session.getState());
        assertEquals(0, session.registeredCallbacks());
    }

    @Test
    void testStartFailureSurfacesTransportException() {
        session.subscribe(DATASET, Schema.TRADES, List.of("NVDA"));
        transport.startFailure = new IllegalStateException("gateway refused session");

        TransportException error = assertThrows(TransportException.class, session::start);

        assertInstanceOf(IllegalStateException.class, error.getCause());
        assertEquals(ConnectionState.DISCONNECTED, session.getState());
        assertEquals(0, session.registeredCallbacks());
        assertThrows(TransportException.class, session.records()::take);
    }

    @Test
    void testReconnectReturnsToConnected() {
        subscribeAndStart();
        RecordStream<Record> records = session.records();

        session.reconnect();

        assertEquals(ConnectionState.CONNECTED, session.getState());
        assertTrue(transitions.contains(ConnectionState.RECONNECTING));
        assertTrue(records.isClosedForWriting());
        assertEquals(1, transport.reconnectCalls.get());
        assertEquals(1, transport.startCalls.get());
    }

    @Test
    void testReconnectFailureMovesToDisconnected() {
        transport.reconnectFailure = new IllegalStateException("no route to host");

        assertThrows(TransportException.class, session::reconnect);

        assertEquals(ConnectionState.DISCONNECTED, session.getState());
        assertEquals(1, errors.size());
    }

    @Test
    void testConsumerCancelStopsSession() throws InterruptedException {
        subscribeAndStart();

        session.records().cancel();

        awaitState(session, ConnectionState.STOPPED);
        assertEquals(1, transport.stopCalls.get());
        assertEquals("test-control", transport.stopThread);
    }

    @Test
    void testStrictDecodeFailureStopsOnControlThread() throws InterruptedException {
        subscribeAndStart();

        transport.deliverAsync(truncatedTrade()).join(5_000);

        awaitState(session, ConnectionState.STOPPED);
        assertEquals("test-control", transport.stopThread);
    }

    @Test
    void testCloseShutsDownControlThread() throws InterruptedException {
        subscribeAndStart();
        session.records().cancel();
        awaitState(session, ConnectionState.STOPPED);

        session.close();

        assertTrue(awaitControlThreadExit());
        session.records().cancel();
        assertEquals(1, transport.stopCalls.get());
    }

    private static boolean awaitControlThreadExit() throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (System.nanoTime() < deadline) {
            boolean alive = Thread.getAllStackTraces().keySet().stream()
                .anyMatch(thread -> thread.getName().equals("test-control") && thread.isAlive());
            if (!alive) {
                return true;
            }
            Thread.sleep(10);
        }
        return false;
    }

    @Test
    void testTransportStopErrorIsCountedNotThrown() {
        subscribeAndStart();
        transport.stopFailure = new IllegalStateException("socket already closed");

        session.stop();

        assertEquals(ConnectionState.STOPPED, session.getState());
        assertEquals(1, errors.size());
    }

    // ==================== Disposal ====================

    @Test
    void testCloseDisposesSession() {
        subscribeAndStart();

        session.close();
        session.close();

        assertTrue(session.isDisposed());
        assertEquals(1, transport.closeCalls.get());
        assertEquals(ConnectionState.STOPPED, session.getState());
        assertThrows(UsageException.class, () -> session.subscribe(DATASET, Schema.TRADES, List.of("NVDA")));
        assertThrows(UsageException.class, session::start);
        assertThrows(UsageException.class, session::reconnect);
        assertThrows(UsageException.class, session::resubscribe);
    }

    @Test
    void testCloseSwallowsTransportCloseError() {
        transport.closeFailure = new IllegalStateException("already closed");

        session.close();

        assertTrue(session.isDisposed());
        assertEquals(1, errors.size());
    }

    /**
     * Holds the first callback inside the session until released.
     */
    private static final class BlockingMetrics extends FeedMetrics {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);

        BlockingMetrics() {
            super(new CollectorRegistry());
        }

        @Override
        public void recordReceived(String session, int rtype) {
            entered.countDown();
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            super.recordReceived(session, rtype);
        }
    }
}
