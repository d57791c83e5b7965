package io.trading.feed.metrics;

import io.prometheus.client.CollectorRegistry;
import io.trading.feed.live.ConnectionState;
import io.trading.marketdata.dbn.model.RType;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for FeedMetrics.
 */
class FeedMetricsTest {

    @Test
    void testCountersPerSession() {
        CollectorRegistry registry = new CollectorRegistry();
        FeedMetrics metrics = new FeedMetrics(registry);

        metrics.recordDecoded("a", RType.MBP_0.code());
        metrics.recordDecoded("a", RType.MBP_0.code());
        metrics.recordDecoded("b", RType.MBP_0.code());
        metrics.recordDecodeError("a");

        assertEquals(2.0, metrics.getRecordsDecoded("a", RType.MBP_0.code()));
        assertEquals(1.0, metrics.getRecordsDecoded("b", RType.MBP_0.code()));
        assertEquals(1.0, metrics.getDecodeErrors("a"));
        assertEquals(0.0, metrics.getDecodeErrors("b"));
        assertEquals(2.0, registry.getSampleValue("feed_records_decoded_total",
            new String[]{"session", "rtype"}, new String[]{"a", "mbp_0"}));
    }

    @Test
    void testUnknownRtypeLabel() {
        CollectorRegistry registry = new CollectorRegistry();
        FeedMetrics metrics = new FeedMetrics(registry);

        metrics.recordReceived("a", 0x7F);

        assertEquals(1.0, registry.getSampleValue("feed_records_received_total",
            new String[]{"session", "rtype"}, new String[]{"a", "unknown"}));
    }

    @Test
    void testConnectionStateGauge() {
        FeedMetrics metrics = new FeedMetrics(new CollectorRegistry());

        metrics.setConnectionState("a", ConnectionState.STREAMING);

        assertEquals(ConnectionState.STREAMING.ordinal(), metrics.getConnectionState("a"));
    }

    @Test
    void testJvmMetricsRegistered() {
        CollectorRegistry registry = new CollectorRegistry();

        FeedMetrics.registerJvmMetrics(registry);

        assertNotNull(registry.getSampleValue("jvm_threads_current"));
    }
}
