package org.areaflow.engine.api.exception;

import lombok.Getter;

/**
 * Exception thrown when a stored access token cannot be decrypted to a usable value.
 */
@Getter
public class InvalidTokenException extends RuntimeException {

    private final String userId;
    private final String providerKey;

    public InvalidTokenException(String userId, String providerKey) {
        super("Stored " + providerKey + " access token for user " + userId + " is unusable");
        this.userId = userId;
        this.providerKey = providerKey;
    }
}
