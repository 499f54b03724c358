package org.areaflow.engine.api.exception;

import lombok.Getter;

/**
 * Exception thrown when a provider call still fails authentication after the single allowed refresh.
 */
@Getter
public class AuthenticationExhaustedException extends RuntimeException {

    private final String userId;
    private final String providerKey;

    public AuthenticationExhaustedException(String userId, String providerKey, String message, Throwable cause) {
        super(message, cause);
        this.userId = userId;
        this.providerKey = providerKey;
    }
}
