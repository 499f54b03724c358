package org.areaflow.engine.detection;

import lombok.extern.slf4j.Slf4j;
import org.areaflow.engine.store.KeyValueStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

/**
 * Last observed signal per (action, user[, scope]). An empty string is the "no prior observation"
 * sentinel written when the upstream list is empty; a missing key means never polled.
 */
@Component
@Slf4j
public class DetectionCache {

    private static final String KEY_PREFIX = "detection:";
    private static final String EMPTY_SENTINEL = "";

    private final KeyValueStore keyValueStore;
    private final Duration ttl;

    public DetectionCache(KeyValueStore keyValueStore,
                          @Value("${area.engine.detection.ttl:0s}") Duration ttl) {
        this.keyValueStore = keyValueStore;
        this.ttl = ttl;
    }

    /**
     * @return the last recorded signal id, empty when never observed or reset
     */
    public Optional<String> lastSignal(String actionName, String userId, String scope) {
        return keyValueStore.get(buildKey(actionName, userId, scope))
                .filter(value -> !EMPTY_SENTINEL.equals(value));
    }

    public void record(String actionName, String userId, String scope, String signalId) {
        keyValueStore.set(buildKey(actionName, userId, scope), signalId, ttl);
        log.debug("Recorded detection state: action={}, userId={}, scope={}, signal={}", actionName, userId, scope, signalId);
    }

    /**
     * Forget the last observation; the next non-empty poll always triggers.
     */
    public void reset(String actionName, String userId, String scope) {
        keyValueStore.set(buildKey(actionName, userId, scope), EMPTY_SENTINEL, ttl);
        log.debug("Reset detection state: action={}, userId={}, scope={}", actionName, userId, scope);
    }

    public void clear(String actionName, String userId, String scope) {
        keyValueStore.delete(buildKey(actionName, userId, scope));
    }

    private String buildKey(String actionName, String userId, String scope) {
        String key = KEY_PREFIX + actionName + ":" + userId;
        return scope == null || scope.isBlank() ? key : key + ":" + scope;
    }
}
