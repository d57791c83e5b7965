package io.trading.feed.config;

import io.trading.feed.bridge.BackpressurePolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Function;

/**
 * Configuration for a feed client session.
 *
 * @param sessionName         Name used in log lines and metric labels
 * @param queueCapacity       Capacity of the record queue under {@link BackpressurePolicy#BLOCK}
 * @param backpressurePolicy  Producer behavior when the record queue is full
 * @param decodeMode          Handling of records that fail to decode
 * @param quiescenceTimeoutMs Upper bound on waiting for in-flight callbacks during teardown
 * @param gatewayHost         Live gateway host
 * @param gatewayPort         Live gateway port
 */
public record FeedClientConfig(
    String sessionName,
    int queueCapacity,
    BackpressurePolicy backpressurePolicy,
    DecodeMode decodeMode,
    long quiescenceTimeoutMs,
    String gatewayHost,
    int gatewayPort
) {
    private static final Logger LOGGER = LoggerFactory.getLogger(FeedClientConfig.class);

    private static final String DEFAULT_SESSION_NAME = "feed-0";
    private static final int DEFAULT_QUEUE_CAPACITY = 65_536;
    private static final long DEFAULT_QUIESCENCE_TIMEOUT_MS = 5_000;
    private static final String DEFAULT_GATEWAY_HOST = "localhost";
    private static final int DEFAULT_GATEWAY_PORT = 13_000;

    public FeedClientConfig {
        if (sessionName == null || sessionName.isEmpty()) {
            throw new IllegalArgumentException("sessionName cannot be null or empty");
        }
        if (queueCapacity <= 0) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        if (backpressurePolicy == null) {
            throw new IllegalArgumentException("backpressurePolicy cannot be null");
        }
        if (decodeMode == null) {
            throw new IllegalArgumentException("decodeMode cannot be null");
        }
        if (quiescenceTimeoutMs < 0) {
            throw new IllegalArgumentException("quiescenceTimeoutMs cannot be negative");
        }
        if (gatewayHost == null || gatewayHost.isEmpty()) {
            throw new IllegalArgumentException("gatewayHost cannot be null or empty");
        }
        if (gatewayPort < 1 || gatewayPort > 65535) {
            throw new IllegalArgumentException("gatewayPort must be between 1 and 65535");
        }
    }

    public Duration quiescenceTimeout() {
        return Duration.ofMillis(quiescenceTimeoutMs);
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - FEED_SESSION_NAME: Session name (default: "feed-0")
     * - FEED_QUEUE_CAPACITY: Record queue capacity (default: 65536)
     * - FEED_BACKPRESSURE: "block" or "unbounded" (default: block)
     * - FEED_DECODE_MODE: "strict" or "lenient" (default: strict)
     * - FEED_QUIESCENCE_TIMEOUT_MS: Teardown wait bound (default: 5000)
     * - FEED_GATEWAY_HOST: Live gateway host (default: "localhost")
     * - FEED_GATEWAY_PORT: Live gateway port (default: 13000)
     */
    public static FeedClientConfig fromEnv() {
        return fromEnv(System::getenv);
    }

    /**
     * Loads configuration from an arbitrary variable lookup. Unset or invalid values fall back
     * to defaults.
     */
    public static FeedClientConfig fromEnv(Function<String, String> env) {
        return new FeedClientConfig(
            stringEnv(env, "FEED_SESSION_NAME", DEFAULT_SESSION_NAME),
            (int) longEnv(env, "FEED_QUEUE_CAPACITY", DEFAULT_QUEUE_CAPACITY),
            enumEnv(env, "FEED_BACKPRESSURE", BackpressurePolicy::fromString, BackpressurePolicy.BLOCK),
            enumEnv(env, "FEED_DECODE_MODE", DecodeMode::fromString, DecodeMode.STRICT),
            longEnv(env, "FEED_QUIESCENCE_TIMEOUT_MS", DEFAULT_QUIESCENCE_TIMEOUT_MS),
            stringEnv(env, "FEED_GATEWAY_HOST", DEFAULT_GATEWAY_HOST),
            (int) longEnv(env, "FEED_GATEWAY_PORT", DEFAULT_GATEWAY_PORT)
        );
    }

    private static String stringEnv(Function<String, String> env, String key, String defaultValue) {
        String value = env.apply(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static long longEnv(Function<String, String> env, String key, long defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            long parsed = Long.parseLong(value.trim());
            if (parsed < 0 || parsed > Integer.MAX_VALUE) {
                LOGGER.warn("Out of range {} value: {}, using default: {}", key, value, defaultValue);
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static <E extends Enum<E>> E enumEnv(
        Function<String, String> env, String key, Function<String, E> parser, E defaultValue) {
        String value = env.apply(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Creates a new builder for FeedClientConfig.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for FeedClientConfig.
     */
    public static class Builder {
        private String sessionName = DEFAULT_SESSION_NAME;
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private BackpressurePolicy backpressurePolicy = BackpressurePolicy.BLOCK;
        private DecodeMode decodeMode = DecodeMode.STRICT;
        private long quiescenceTimeoutMs = DEFAULT_QUIESCENCE_TIMEOUT_MS;
        private String gatewayHost = DEFAULT_GATEWAY_HOST;
        private int gatewayPort = DEFAULT_GATEWAY_PORT;

        public Builder sessionName(String sessionName) {
            this.sessionName = sessionName;
            return this;
        }

        public Builder queueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder backpressurePolicy(BackpressurePolicy backpressurePolicy) {
            this.backpressurePolicy = backpressurePolicy;
            return this;
        }

        public Builder decodeMode(DecodeMode decodeMode) {
            this.decodeMode = decodeMode;
            return this;
        }

        public Builder quiescenceTimeoutMs(long quiescenceTimeoutMs) {
            this.quiescenceTimeoutMs = quiescenceTimeoutMs;
            return this;
        }

        public Builder gatewayHost(String gatewayHost) {
            this.gatewayHost = gatewayHost;
            return this;
        }

        public Builder gatewayPort(int gatewayPort) {
            this.gatewayPort = gatewayPort;
            return this;
        }

        public FeedClientConfig build() {
            return new FeedClientConfig(
                sessionName,
                queueCapacity,
                backpressurePolicy,
                decodeMode,
                quiescenceTimeoutMs,
                gatewayHost,
                gatewayPort
            );
        }
    }
}
