package org.areaflow.engine.credential;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.areaflow.engine.api.exception.AuthenticationExhaustedException;
import org.areaflow.engine.api.exception.InvalidTokenException;
import org.areaflow.engine.api.exception.NoLinkedAccountException;
import org.areaflow.engine.api.exception.ProviderUnauthorizedException;
import org.areaflow.engine.provider.IdentityProvider;
import org.areaflow.engine.provider.ProviderRegistry;
import org.areaflow.engine.provider.TokenGrant;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.function.Function;

/**
 * Single place where stored tokens are decrypted, refreshed and retried.
 * Each call performs at most one refresh; a call that still fails authentication after it
 * raises {@link AuthenticationExhaustedException}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CredentialResolver {

    private final CredentialStore credentialStore;
    private final TokenCrypto tokenCrypto;
    private final ProviderRegistry providerRegistry;
    private final Clock clock;

    /**
     * Run {@code call} with a plaintext access token for (userId, providerKey).
     * The call signals an upstream 401 by throwing {@link ProviderUnauthorizedException}.
     *
     * @throws NoLinkedAccountException        if no credential is stored
     * @throws InvalidTokenException           if the stored access token cannot be decrypted
     * @throws AuthenticationExhaustedException if refresh fails or the refreshed token is rejected
     */
    public <T> T withAccessToken(String userId, String providerKey, Function<String, T> call) {
        Credential credential = credentialStore.get(userId, providerKey)
                .orElseThrow(() -> new NoLinkedAccountException(userId, providerKey));
        String accessToken = tokenCrypto.decrypt(credential.accessToken())
                .filter(token -> !token.isBlank())
                .orElseThrow(() -> new InvalidTokenException(userId, providerKey));

        boolean refreshed = false;
        if (credential.isExpiredAt(clock.instant())) {
            log.debug("Access token expired, refreshing: provider={}, userId={}", providerKey, userId);
            accessToken = refresh(userId, providerKey, credential);
            refreshed = true;
        }

        try {
            return call.apply(accessToken);
        } catch (ProviderUnauthorizedException e) {
            if (refreshed) {
                throw new AuthenticationExhaustedException(userId, providerKey,
                        providerKey + " rejected a freshly refreshed token", e);
            }
            log.debug("Access token rejected, refreshing once: provider={}, userId={}", providerKey, userId);
        }

        String retriedToken = refresh(userId, providerKey, credential);
        try {
            return call.apply(retriedToken);
        } catch (ProviderUnauthorizedException e) {
            throw new AuthenticationExhaustedException(userId, providerKey,
                    providerKey + " rejected a freshly refreshed token", e);
        }
    }

    private String refresh(String userId, String providerKey, Credential credential) {
        IdentityProvider identity = providerRegistry.getIdentity(providerKey)
                .orElseThrow(() -> new AuthenticationExhaustedException(userId, providerKey,
                        "No identity provider can refresh " + providerKey + " tokens", null));
        TokenGrant grant;
        try {
            grant = identity.refresh(userId);
        } catch (RuntimeException e) {
            throw new AuthenticationExhaustedException(userId, providerKey,
                    "Token refresh failed for " + providerKey + ": " + e.getMessage(), e);
        }

        Credential updated = credential.withAccessToken(tokenCrypto.encrypt(grant.accessToken()), grant.expiresAt());
        if (grant.refreshToken() != null) {
            updated = updated.withRefreshToken(tokenCrypto.encrypt(grant.refreshToken()));
        }
        credentialStore.save(userId, providerKey, updated);
        return grant.accessToken();
    }
}
