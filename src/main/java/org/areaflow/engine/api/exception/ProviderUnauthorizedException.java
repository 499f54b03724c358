package org.areaflow.engine.api.exception;

import lombok.Getter;

/**
 * Exception thrown when a provider API answers 401 for the bearer token used.
 */
@Getter
public class ProviderUnauthorizedException extends RuntimeException {

    private final String providerKey;

    public ProviderUnauthorizedException(String providerKey, Throwable cause) {
        super(providerKey + " rejected the access token", cause);
        this.providerKey = providerKey;
    }
}
