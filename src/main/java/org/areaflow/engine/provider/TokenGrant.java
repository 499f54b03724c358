package org.areaflow.engine.provider;

import java.time.Instant;

/**
 * Plaintext token material returned by an OAuth exchange or refresh. Never persisted as is.
 *
 * @param refreshToken null when the provider did not rotate it
 * @param expiresAt    null when the provider did not report a lifetime
 */
public record TokenGrant(String accessToken, String refreshToken, Instant expiresAt) {

    @Override
    public String toString() {
        return "TokenGrant[expiresAt=" + expiresAt + "]";
    }
}
