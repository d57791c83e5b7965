package io.trading.feed.live;

import io.prometheus.client.CollectorRegistry;
import io.trading.feed.bridge.RecordStream;
import io.trading.feed.config.FeedClientConfig;
import io.trading.feed.metrics.FeedMetrics;
import io.trading.marketdata.dbn.error.FeedException;
import io.trading.marketdata.dbn.error.TransportException;
import io.trading.marketdata.dbn.error.UsageException;
import io.trading.marketdata.dbn.model.Record;
import io.trading.marketdata.dbn.model.SType;
import io.trading.marketdata.dbn.model.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Controls a live market-data session over a {@link LiveTransport}: subscriptions, the
 * connection state machine, and the record stream the transport's callbacks feed.
 *
 * <p>Control operations are serialized. Transport callbacks run on transport threads and never
 * take the control lock. Teardown sets the streaming session to STOPPING, waits (bounded) for
 * running callbacks to finish, and only then releases the callback registration, so no callback
 * touches session state once the session reports STOPPED.
 *
 * <p>Stops triggered by consumer cancellation or a strict decode failure run on a single
 * control thread owned by the session and shut down by {@link #close()}.
 */
public class LiveSession implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(LiveSession.class);

    private static final AtomicLong SESSION_IDS = new AtomicLong();
    private static final long CONTROL_SHUTDOWN_TIMEOUT_MS = 5_000;

    private static final Set<ConnectionState> LIVE_STATES =
        EnumSet.of(ConnectionState.CONNECTING, ConnectionState.CONNECTED, ConnectionState.STREAMING);

    private final LiveTransport transport;
    private final FeedClientConfig config;
    private final FeedMetrics metrics;
    private final String name;

    private final CallbackRegistry registry = new CallbackRegistry();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();
    private final ReentrantLock controlLock = new ReentrantLock();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
    private final ExecutorService controlExecutor;

    private volatile StreamingSession current;
    private volatile RecordStream<Record> lastStream;
    private volatile boolean disposed;

    /**
     * Creates a session with metrics in a private registry.
     */
    public LiveSession(LiveTransport transport, FeedClientConfig config) {
        this(transport, config, new FeedMetrics(new CollectorRegistry()));
    }

    public LiveSession(LiveTransport transport, FeedClientConfig config, FeedMetrics metrics) {
        if (transport == null) {
            throw new IllegalArgumentException("transport cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics cannot be null");
        }
        this.transport = transport;
        this.config = config;
        this.metrics = metrics;
        this.name = config.sessionName();
        this.controlExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, name + "-control");
            thread.setDaemon(true);
            return thread;
        });
        metrics.setConnectionState(name, ConnectionState.DISCONNECTED);
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    // ==================== Subscriptions ====================

    /**
     * Subscribes to {@code schema} records for raw symbols.
     *
     * @throws UsageException on invalid arguments, while streaming, or after close
     */
    public void subscribe(String dataset, Schema schema, List<String> symbols) {
        subscribe(newSubscription(dataset, schema, SType.RAW_SYMBOL, symbols, false));
    }

    /**
     * As {@link #subscribe(String, Schema, List)}, also requesting an initial book snapshot.
     */
    public void subscribeWithSnapshot(String dataset, Schema schema, List<String> symbols) {
        subscribe(newSubscription(dataset, schema, SType.RAW_SYMBOL, symbols, true));
    }

    public void subscribe(Subscription subscription) {
        if (subscription == null) {
            throw new UsageException("subscription cannot be null");
        }
        controlLock.lock();
        try {
            ensureNotDisposed("subscribe");
            if (state.get() == ConnectionState.STREAMING) {
                throw new UsageException("Cannot subscribe while streaming; stop first");
            }
            callTransport("subscribe", () -> transport.subscribe(subscription));
            subscriptions.add(subscription);
            LOGGER.debug("[{}] Subscribed dataset={} schema={} symbols={} snapshot={}",
                name, subscription.dataset(), subscription.schema(), subscription.symbols(), subscription.snapshot());
        } finally {
            controlLock.unlock();
        }
    }

    /**
     * Reissues every recorded subscription in its original order.
     */
    public void resubscribe() {
        controlLock.lock();
        try {
            ensureNotDisposed("resubscribe");
            if (state.get() == ConnectionState.STREAMING) {
                throw new UsageException("Cannot resubscribe while streaming; stop first");
            }
            for (Subscription subscription : subscriptions) {
                callTransport("resubscribe", () -> transport.subscribe(subscription));
            }
            LOGGER.info("[{}] Resubscribed {} subscription(s)", name, subscriptions.size());
        } finally {
            controlLock.unlock();
        }
    }

    /**
     * Subscriptions recorded so far, in request order.
     */
    public List<Subscription> getSubscriptions() {
        return List.copyOf(subscriptions);
    }

    private static Subscription newSubscription(
        String dataset, Schema schema, SType stypeIn, List<String> symbols, boolean snapshot) {
        try {
            return new Subscription(dataset, schema, stypeIn, symbols, snapshot);
        } catch (IllegalArgumentException e) {
            throw new UsageException("Invalid subscription: " + e.getMessage(), e);
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Starts streaming into a fresh record stream, available from {@link #records()}.
     *
     * @throws UsageException     if already started, or after close
     * @throws TransportException if the transport fails to start
     */
    public void start() {
        controlLock.lock();
        try {
            ensureNotDisposed("start");
            StreamingSession previous = current;
            if (previous != null && previous.isActive()) {
                throw new UsageException("Session already started; stop before starting again");
            }
            if (subscriptions.isEmpty()) {
                throw new UsageException("Cannot start without a subscription");
            }
            if (previous != null) {
                teardown(previous);
            }

            if (state.get() != ConnectionState.CONNECTED) {
                transition(ConnectionState.CONNECTING);
            }

            StreamingSession session = newStreamingSession();
            registry.register(session);
            current = session;
            lastStream = session.stream();

            try {
                transport.start(session::onRecord, error -> onTransportError(session, error));
            } catch (RuntimeException e) {
                TransportException failure = asTransportException("start", e);
                LOGGER.error("[{}] Failed to start streaming", name, e);
                session.beginStop();
                session.stream().fail(failure);
                session.markStopped();
                registry.unregister(session.id());
                current = null;
                transition(ConnectionState.DISCONNECTED);
                notifyError(failure);
                throw failure;
            }

            compareAndTransition(ConnectionState.CONNECTING, ConnectionState.CONNECTED);
            compareAndTransition(ConnectionState.CONNECTED, ConnectionState.STREAMING);
            LOGGER.info("[{}] Streaming started with {} subscription(s)", name, subscriptions.size());
        } finally {
            controlLock.unlock();
        }
    }

    /**
     * Stops streaming. Waits, bounded by the configured quiescence timeout, for running callbacks
     * to finish, then closes the record stream for writing. Idempotent.
     */
    public void stop() {
        controlLock.lock();
        try {
            if (disposed) {
                return;
            }
            stopInternal();
        } finally {
            controlLock.unlock();
        }
    }

    /**
     * Stops streaming and re-establishes the transport connection. Neither streaming nor
     * subscriptions are restored; call {@link #resubscribe()} and {@link #start()}.
     *
     * @throws TransportException if the transport cannot reconnect; the state becomes DISCONNECTED
     */
    public void reconnect() {
        controlLock.lock();
        try {
            ensureNotDisposed("reconnect");
            transition(ConnectionState.RECONNECTING);
            StreamingSession session = current;
            if (session != null) {
                teardown(session);
                current = null;
            }
            try {
                transport.reconnect();
            } catch (RuntimeException e) {
                TransportException failure = asTransportException("reconnect", e);
                LOGGER.error("[{}] Reconnect failed", name, e);
                transition(ConnectionState.DISCONNECTED);
                notifyError(failure);
                throw failure;
            }
            transition(ConnectionState.CONNECTED);
            LOGGER.info("[{}] Reconnected", name);
        } finally {
            controlLock.unlock();
        }
    }

    /**
     * Stops streaming, releases the transport and shuts down the control thread. The session
     * cannot be used afterwards.
     */
    @Override
    public void close() {
        controlLock.lock();
        try {
            if (disposed) {
                return;
            }
            stopInternal();
            try {
                transport.close();
            } catch (RuntimeException e) {
                LOGGER.warn("[{}] Transport close failed", name, e);
                metrics.recordTeardownError(name);
                notifyError(e);
            }
            disposed = true;
        } finally {
            controlLock.unlock();
        }
        // outside the lock: queued stop tasks take it and then see the session disposed
        shutdownControlExecutor();
        LOGGER.info("[{}] Closed", name);
    }

    private void shutdownControlExecutor() {
        controlExecutor.shutdown();
        try {
            if (!controlExecutor.awaitTermination(CONTROL_SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                LOGGER.warn("[{}] Control thread did not finish within {} ms", name, CONTROL_SHUTDOWN_TIMEOUT_MS);
                controlExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            controlExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ==================== Accessors ====================

    /**
     * The record stream of the current, or most recent, streaming span.
     *
     * @throws UsageException if the session has never been started
     */
    public RecordStream<Record> records() {
        RecordStream<Record> stream = lastStream;
        if (stream == null) {
            throw new UsageException("Session has not been started");
        }
        return stream;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public boolean isDisposed() {
        return disposed;
    }

    public String getName() {
        return name;
    }

    int registeredCallbacks() {
        return registry.size();
    }

    // ==================== Teardown ====================

    private void stopInternal() {
        StreamingSession session = current;
        if (session != null) {
            teardown(session);
            current = null;
        }
        if (state.get() != ConnectionState.STOPPED) {
            transition(ConnectionState.STOPPED);
            LOGGER.info("[{}] Stopped", name);
        }
    }

    private void teardown(StreamingSession session) {
        if (session.lifecycle() == StreamingSession.Lifecycle.STOPPED) {
            return;
        }
        session.beginStop();

        // before the transport stop: a producer blocked on a full queue holds the transport's
        // I/O thread, which the transport may wait on. Queued records still drain.
        session.stream().complete();

        try {
            transport.stop();
        } catch (RuntimeException e) {
            LOGGER.warn("[{}] Transport stop failed", name, e);
            metrics.recordTeardownError(name);
            notifyError(e);
        }

        boolean quiesced;
        try {
            quiesced = session.awaitQuiescence(config.quiescenceTimeout());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warn("[{}] Interrupted while waiting for in-flight callbacks", name);
            quiesced = false;
        }

        session.markStopped();
        if (quiesced) {
            registry.unregister(session.id());
        } else {
            LOGGER.warn("[{}] {} callback(s) still running after {} ms; releasing once they finish",
                name, session.inFlight(), config.quiescenceTimeoutMs());
            metrics.recordQuiescenceTimeout(name);
            session.releaseWhenQuiescent(() -> registry.unregister(session.id()));
        }
    }

    private void stopIfCurrent(long sessionId) {
        controlLock.lock();
        try {
            StreamingSession session = current;
            if (disposed || session == null || session.id() != sessionId) {
                return;
            }
            LOGGER.info("[{}] Stopping after consumer cancellation or stream failure", name);
            stopInternal();
        } finally {
            controlLock.unlock();
        }
    }

    private void stopAsync(long sessionId) {
        try {
            controlExecutor.execute(() -> stopIfCurrent(sessionId));
        } catch (RejectedExecutionException e) {
            LOGGER.debug("[{}] Session closed; streaming session {} already stopped", name, sessionId);
        }
    }

    private StreamingSession newStreamingSession() {
        long id = SESSION_IDS.incrementAndGet();
        RecordStream<Record> stream = new RecordStream<>(
            name + "-" + id, config.queueCapacity(), config.backpressurePolicy());
        stream.onCancel(() -> stopIfCurrent(id), controlExecutor);
        return new StreamingSession(id, name, stream, config.decodeMode(), metrics, () -> stopAsync(id));
    }

    // ==================== Transport Errors ====================

    private void onTransportError(StreamingSession session, Throwable error) {
        TransportException failure = error instanceof TransportException transportError
            ? transportError
            : new TransportException("Transport failure: " + error.getMessage(), error);
        LOGGER.error("[{}] Transport error", name, error);

        session.beginStop();
        // the registration is released by the next stop, start, reconnect or close
        if (current == session) {
            transitionIfIn(LIVE_STATES, ConnectionState.DISCONNECTED);
        }
        session.stream().fail(failure);
        notifyError(failure);
    }

    private void callTransport(String action, Runnable operation) {
        try {
            operation.run();
        } catch (RuntimeException e) {
            throw asTransportException(action, e);
        }
    }

    private static TransportException asTransportException(String action, RuntimeException e) {
        if (e instanceof TransportException transportError) {
            return transportError;
        }
        if (e instanceof FeedException) {
            throw e;
        }
        return new TransportException("Transport " + action + " failed: " + e.getMessage(), e);
    }

    // ==================== State Machine ====================

    private void transition(ConnectionState to) {
        ConnectionState from = state.getAndSet(to);
        if (from != to) {
            onTransition(from, to);
        }
    }

    private void compareAndTransition(ConnectionState expected, ConnectionState to) {
        if (state.compareAndSet(expected, to)) {
            onTransition(expected, to);
        }
    }

    private void transitionIfIn(Set<ConnectionState> allowed, ConnectionState to) {
        while (true) {
            ConnectionState from = state.get();
            if (!allowed.contains(from)) {
                return;
            }
            if (state.compareAndSet(from, to)) {
                onTransition(from, to);
                return;
            }
        }
    }

    private void onTransition(ConnectionState from, ConnectionState to) {
        LOGGER.info("[{}] State {} -> {}", name, from, to);
        metrics.setConnectionState(name, to);
        for (SessionListener listener : listeners) {
            try {
                listener.onStateChanged(from, to);
            } catch (RuntimeException e) {
                LOGGER.error("[{}] Session listener failed on state change", name, e);
            }
        }
    }

    private void notifyError(Throwable error) {
        for (SessionListener listener : listeners) {
            try {
                listener.onError(error);
            } catch (RuntimeException e) {
                LOGGER.error("[{}] Session listener failed on error", name, e);
            }
        }
    }

    private void ensureNotDisposed(String operation) {
        if (disposed) {
            throw new UsageException("Cannot " + operation + ": session is closed");
        }
    }
}
