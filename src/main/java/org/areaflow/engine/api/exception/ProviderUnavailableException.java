package org.areaflow.engine.api.exception;

import lombok.Getter;

/**
 * Exception thrown on a transient upstream failure (network error, 5xx, rate limit).
 */
@Getter
public class ProviderUnavailableException extends RuntimeException {

    private final String providerKey;

    public ProviderUnavailableException(String providerKey, String message, Throwable cause) {
        super(message, cause);
        this.providerKey = providerKey;
    }
}
