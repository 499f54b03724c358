package org.areaflow.engine.credential;

import java.time.Instant;

/**
 * Stored OAuth credential of one user for one provider. Token fields hold ciphertext only.
 *
 * @param accessToken  encrypted access token
 * @param refreshToken encrypted refresh token, may be null
 * @param expiresAt    access token expiry, null when unknown
 */
public record Credential(String accessToken, String refreshToken, Instant expiresAt) {

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    public Credential withAccessToken(String encryptedAccessToken, Instant newExpiresAt) {
        return new Credential(encryptedAccessToken, refreshToken, newExpiresAt);
    }

    public Credential withRefreshToken(String encryptedRefreshToken) {
        return new Credential(accessToken, encryptedRefreshToken, expiresAt);
    }
}
