package org.areaflow.engine.store;

import java.time.Duration;
import java.util.Optional;

/**
 * String key/value store with optional per-key expiry.
 * Backs both the credential store and the detection cache. Writes to a single key are
 * last-write-wins; implementations must not corrupt a key under concurrent writes.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value);

    /**
     * Set a value that expires after {@code ttl}. A zero or negative TTL stores the value without expiry.
     */
    void set(String key, String value, Duration ttl);

    /**
     * @return true if a value was removed
     */
    boolean delete(String key);

    boolean exists(String key);

    /**
     * Remaining time to live. Empty if the key is missing or has no expiry.
     */
    Optional<Duration> ttl(String key);
}
