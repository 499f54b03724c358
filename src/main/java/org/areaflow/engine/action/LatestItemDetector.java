package org.areaflow.engine.action;

import lombok.extern.slf4j.Slf4j;
import org.areaflow.engine.api.exception.InvalidTokenException;
import org.areaflow.engine.api.exception.NoLinkedAccountException;
import org.areaflow.engine.detection.DetectionCache;

import java.util.Map;
import java.util.Optional;

/**
 * Edge detector over "newest item" endpoints: fires once per distinct newest id.
 * An empty upstream list resets the detection state, so any id seen afterwards fires again.
 * An item without an id leaves the state untouched.
 * {@code AuthenticationExhaustedException} and {@code ProviderUnavailableException} propagate to the caller.
 */
@Slf4j
public abstract class LatestItemDetector<T> implements ActionExecutor {

    private final DetectionCache detectionCache;

    protected LatestItemDetector(DetectionCache detectionCache) {
        this.detectionCache = detectionCache;
    }

    /**
     * Request exactly one item from the provider.
     *
     * @return empty when the upstream list is empty
     */
    protected abstract Optional<LatestItem<T>> fetchLatest(String userId, Map<String, Object> actionConfig);

    protected abstract Map<String, String> payload(String userId, Map<String, Object> actionConfig, LatestItem<T> latest);

    /**
     * Narrows the detection state below (action, user); null when state is per user only.
     */
    protected String scope(Map<String, Object> actionConfig) {
        return null;
    }

    @Override
    public Signal detect(String userId, Map<String, Object> actionConfig) {
        Optional<LatestItem<T>> fetched;
        try {
            fetched = fetchLatest(userId, actionConfig);
        } catch (NoLinkedAccountException | InvalidTokenException e) {
            log.debug("No usable account: action={}, userId={}, reason={}", name(), userId, e.getMessage());
            return Signal.noAccount();
        }

        String scope = scope(actionConfig);
        if (fetched.isEmpty()) {
            detectionCache.reset(name(), userId, scope);
            return Signal.unchanged();
        }

        LatestItem<T> latest = fetched.get();
        if (latest.id() == null || latest.id().isBlank()) {
            log.debug("Latest item has no id: action={}, userId={}", name(), userId);
            return Signal.unchanged();
        }

        Optional<String> last = detectionCache.lastSignal(name(), userId, scope);
        log.debug("Poll result: action={}, userId={}, cached={}, latest={}", name(), userId, last.orElse(null), latest.id());
        if (last.isPresent() && last.get().equals(latest.id())) {
            return Signal.unchanged();
        }

        detectionCache.record(name(), userId, scope, latest.id());
        log.info("Trigger detected: action={}, userId={}, signal={}", name(), userId, latest.id());
        return Signal.triggered(latest.id(), payload(userId, actionConfig, latest));
    }

    protected static String text(Object value) {
        return value == null ? null : value.toString();
    }
}
