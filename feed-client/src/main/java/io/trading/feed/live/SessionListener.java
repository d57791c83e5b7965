package io.trading.feed.live;

/**
 * Observer of live session lifecycle events. Invoked synchronously; implementations must not block.
 */
public interface SessionListener {

    default void onStateChanged(ConnectionState previous, ConnectionState current) {
    }

    default void onError(Throwable error) {
    }
}
