package io.trading.feed.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Summary;
import io.prometheus.client.hotspot.DefaultExports;
import io.trading.feed.live.ConnectionState;
import io.trading.marketdata.dbn.model.RType;

import java.util.Locale;

/**
 * Prometheus metrics for feed client sessions.
 *
 * Tracks:
 * - Records received and decoded per record type
 * - Decode errors and skipped records
 * - Callbacks rejected after teardown began, and quiescence timeouts
 * - Connection state and record queue depth per session
 * - Decode latency
 */
public class FeedMetrics {

    // Counters
    private final Counter recordsReceived;
    private final Counter recordsDecoded;
    private final Counter decodeErrors;
    private final Counter recordsSkipped;
    private final Counter callbacksRejected;
    private final Counter quiescenceTimeouts;
    private final Counter teardownErrors;

    // Gauges
    private final Gauge connectionState;
    private final Gauge queueDepth;

    // Summary (latency in microseconds)
    private final Summary decodeLatencyMicros;

    /**
     * Creates metrics registered in {@code registry}. Use a dedicated registry per instance
     * in tests to avoid duplicate registration.
     */
    public FeedMetrics(CollectorRegistry registry) {
        this.recordsReceived = Counter.build()
            .name("feed_records_received_total")
            .help("Total number of raw records received from the transport")
            .labelNames("session", "rtype")
            .register(registry);

        this.recordsDecoded = Counter.build()
            .name("feed_records_decoded_total")
            .help("Total number of records decoded and queued for the consumer")
            .labelNames("session", "rtype")
            .register(registry);

        this.decodeErrors = Counter.build()
            .name("feed_decode_errors_total")
            .help("Total number of records that failed to decode")
            .labelNames("session")
            .register(registry);

        this.recordsSkipped = Counter.build()
            .name("feed_records_skipped_total")
            .help("Total number of records skipped in lenient decode mode")
            .labelNames("session")
            .register(registry);

        this.callbacksRejected = Counter.build()
            .name("feed_callbacks_rejected_total")
            .help("Total number of producer callbacks rejected after teardown began")
            .labelNames("session")
            .register(registry);

        this.quiescenceTimeouts = Counter.build()
            .name("feed_quiescence_timeouts_total")
            .help("Total number of teardowns that timed out waiting for in-flight callbacks")
            .labelNames("session")
            .register(registry);

        this.teardownErrors = Counter.build()
            .name("feed_teardown_errors_total")
            .help("Total number of errors raised by the transport while stopping or closing")
            .labelNames("session")
            .register(registry);

        // Connection state gauge (ordinal of ConnectionState)
        this.connectionState = Gauge.build()
            .name("feed_connection_state")
            .help("Connection state ordinal (0 = disconnected ... 5 = stopped)")
            .labelNames("session")
            .register(registry);

        this.queueDepth = Gauge.build()
            .name("feed_queue_depth")
            .help("Number of decoded records waiting for the consumer")
            .labelNames("session")
            .register(registry);

        this.decodeLatencyMicros = Summary.build()
            .name("feed_decode_latency_microseconds")
            .help("Record decode latency in microseconds")
            .labelNames("session")
            .register(registry);
    }

    /**
     * Registers the default JVM collectors (GC, memory, threads) in {@code registry}.
     */
    public static void registerJvmMetrics(CollectorRegistry registry) {
        DefaultExports.register(registry);
    }

    /**
     * Records a raw record handed over by the transport.
     */
    public void recordReceived(String session, int rtype) {
        recordsReceived.labels(session, rtypeLabel(rtype)).inc();
    }

    public void recordDecoded(String session, int rtype) {
        recordsDecoded.labels(session, rtypeLabel(rtype)).inc();
    }

    public void recordDecodeError(String session) {
        decodeErrors.labels(session).inc();
    }

    public void recordSkipped(String session) {
        recordsSkipped.labels(session).inc();
    }

    public void recordCallbackRejected(String session) {
        callbacksRejected.labels(session).inc();
    }

    /**
     * Records a teardown that gave up waiting for in-flight callbacks.
     */
    public void recordQuiescenceTimeout(String session) {
        quiescenceTimeouts.labels(session).inc();
    }

    public void recordTeardownError(String session) {
        teardownErrors.labels(session).inc();
    }

    public void setConnectionState(String session, ConnectionState state) {
        connectionState.labels(session).set(state.ordinal());
    }

    public void setQueueDepth(String session, int depth) {
        queueDepth.labels(session).set(depth);
    }

    public void recordDecodeLatency(String session, long nanos) {
        decodeLatencyMicros.labels(session).observe(nanos / 1000.0);
    }

    // ==================== Accessors for tests and health checks ====================

    public double getDecodeErrors(String session) {
        return decodeErrors.labels(session).get();
    }

    public double getRecordsSkipped(String session) {
        return recordsSkipped.labels(session).get();
    }

    public double getCallbacksRejected(String session) {
        return callbacksRejected.labels(session).get();
    }

    public double getQuiescenceTimeouts(String session) {
        return quiescenceTimeouts.labels(session).get();
    }

    public double getRecordsDecoded(String session, int rtype) {
        return recordsDecoded.labels(session, rtypeLabel(rtype)).get();
    }

    public double getConnectionState(String session) {
        return connectionState.labels(session).get();
    }

    private static String rtypeLabel(int rtype) {
        RType known = RType.fromCode(rtype);
        return known == null ? "unknown" : known.name().toLowerCase(Locale.ROOT);
    }
}
