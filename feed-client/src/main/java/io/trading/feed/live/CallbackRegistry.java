package io.trading.feed.live;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps streaming sessions, and the callbacks the transport holds into them, strongly reachable
 * until their teardown has confirmed that no callback is still running.
 */
final class CallbackRegistry {

    private final Map<Long, StreamingSession> sessions = new ConcurrentHashMap<>();

    void register(StreamingSession session) {
        sessions.put(session.id(), session);
    }

    void unregister(long sessionId) {
        sessions.remove(sessionId);
    }

    boolean contains(long sessionId) {
        return sessions.containsKey(sessionId);
    }

    int size() {
        return sessions.size();
    }
}
