package io.trading.feed.live;

/**
 * Connection state of a live session.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    STREAMING,
    RECONNECTING,
    STOPPED
}
