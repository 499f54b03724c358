package org.areaflow.engine.credential;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.areaflow.engine.store.KeyValueStore;

import java.util.Optional;

/**
 * Credential store kept in the key/value store as one JSON document per (provider, user).
 */
@RequiredArgsConstructor
@Slf4j
public class KeyValueCredentialStore implements CredentialStore {

    private static final String KEY_PREFIX = "credential:";

    private final KeyValueStore keyValueStore;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<Credential> get(String userId, String providerKey) {
        return keyValueStore.get(buildKey(userId, providerKey)).flatMap(json -> {
            try {
                return Optional.of(objectMapper.readValue(json, Credential.class));
            } catch (JsonProcessingException e) {
                log.warn("Unreadable credential record: provider={}, userId={}", providerKey, userId);
                return Optional.empty();
            }
        });
    }

    @Override
    public void save(String userId, String providerKey, Credential credential) {
        try {
            keyValueStore.set(buildKey(userId, providerKey), objectMapper.writeValueAsString(credential));
            log.debug("Stored credential: provider={}, userId={}", providerKey, userId);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize credential for provider " + providerKey, e);
        }
    }

    @Override
    public void clear(String userId, String providerKey) {
        if (keyValueStore.delete(buildKey(userId, providerKey))) {
            log.info("Cleared credential: provider={}, userId={}", providerKey, userId);
        }
    }

    private String buildKey(String userId, String providerKey) {
        return KEY_PREFIX + providerKey + ":" + userId;
    }
}
