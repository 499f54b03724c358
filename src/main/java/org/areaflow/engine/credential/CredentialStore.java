package org.areaflow.engine.credential;

import java.util.Optional;

/**
 * Per (user, provider) storage of encrypted OAuth credentials.
 */
public interface CredentialStore {

    Optional<Credential> get(String userId, String providerKey);

    void save(String userId, String providerKey, Credential credential);

    void clear(String userId, String providerKey);
}
