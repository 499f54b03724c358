package org.areaflow.engine.provider;

import org.areaflow.engine.api.exception.TokenRefreshFailedException;

/**
 * Capability of refreshing a user's access token for one external service.
 */
public interface IdentityProvider {

    String key();

    /**
     * Obtain a fresh access token using the user's stored refresh token.
     *
     * @throws TokenRefreshFailedException if no refresh token is stored or the token endpoint rejects it
     */
    TokenGrant refresh(String userId);
}
