package org.areaflow.engine.client;

import org.areaflow.engine.api.exception.ProviderUnauthorizedException;
import org.areaflow.engine.api.exception.ProviderUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.function.Supplier;

/**
 * Base for third-party REST clients. Translates transport failures into the engine's taxonomy:
 * 401 becomes {@link ProviderUnauthorizedException}, everything else {@link ProviderUnavailableException}.
 */
public abstract class ProviderApiClient {

    protected final RestClient restClient;
    private final String providerKey;

    protected ProviderApiClient(String providerKey, RestClient.Builder restClientBuilder, String baseUrl) {
        this.providerKey = providerKey;
        this.restClient = restClientBuilder.baseUrl(baseUrl).build();
    }

    protected <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            if (e.getStatusCode().isSameCodeAs(HttpStatus.UNAUTHORIZED)) {
                throw new ProviderUnauthorizedException(providerKey, e);
            }
            throw new ProviderUnavailableException(providerKey,
                    providerKey + " " + operation + " failed with status " + e.getStatusCode().value(), e);
        } catch (RestClientException e) {
            throw new ProviderUnavailableException(providerKey,
                    providerKey + " " + operation + " failed: " + e.getMessage(), e);
        }
    }

    protected static String bearer(String accessToken) {
        return "Bearer " + accessToken;
    }
}
