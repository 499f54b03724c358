package org.areaflow.engine.api.exception;

import lombok.Getter;

/**
 * Exception thrown when a user has no stored credential for a provider.
 */
@Getter
public class NoLinkedAccountException extends RuntimeException {

    private final String userId;
    private final String providerKey;

    public NoLinkedAccountException(String userId, String providerKey) {
        super("No linked " + providerKey + " account for user " + userId);
        this.userId = userId;
        this.providerKey = providerKey;
    }
}
