package org.areaflow.engine.api.exception;

import lombok.Getter;

/**
 * Exception thrown by an identity provider when it cannot obtain a fresh access token.
 */
@Getter
public class TokenRefreshFailedException extends RuntimeException {

    private final String providerKey;

    public TokenRefreshFailedException(String providerKey, String message) {
        super(message);
        this.providerKey = providerKey;
    }

    public TokenRefreshFailedException(String providerKey, String message, Throwable cause) {
        super(message, cause);
        this.providerKey = providerKey;
    }
}
