package io.trading.feed.live;

import java.util.function.Consumer;

/**
 * Connection to a live market-data gateway. Authentication, heartbeats and the wire protocol
 * are the implementation's concern.
 */
public interface LiveTransport extends AutoCloseable {

    /**
     * Sends a subscription request, connecting first if needed.
     */
    void subscribe(Subscription subscription);

    /**
     * Starts the session. Records are delivered to {@code callback} and asynchronous failures
     * to {@code errorHandler}, both from transport-owned threads.
     */
    void start(RecordCallback callback, Consumer<Throwable> errorHandler);

    /**
     * Asks the transport to stop delivering records. Callbacks already running may still complete.
     */
    void stop();

    /**
     * Drops the current connection and establishes a new one. Subscriptions are not restored.
     */
    void reconnect();

    @Override
    void close();
}
