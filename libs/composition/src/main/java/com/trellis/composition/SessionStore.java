package com.trellis.composition;

import java.util.Optional;

/**
 * Durable per-browser-session key/value storage, read-your-writes consistent within one session.
 *
 * <p>Values are replaced whole, so concurrent requests of one session race with last write wins
 * and never observe a partially written value.
 */
public interface SessionStore {

    /** Returns the stored value, or empty when the session or key does not exist. */
    Optional<Object> get(String sessionId, String key);

    void set(String sessionId, String key, Object value);

    /** Removes the key; a missing session or key is a no-op. */
    void remove(String sessionId, String key);

    /** Typed read; values of another type are treated as absent. */
    default <T> Optional<T> get(String sessionId, String key, Class<T> type) {
        return get(sessionId, key).filter(type::isInstance).map(type::cast);
    }
}
