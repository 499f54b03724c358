package org.areaflow.engine.provider;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.areaflow.engine.api.exception.TokenRefreshFailedException;
import org.areaflow.engine.credential.Credential;
import org.areaflow.engine.credential.CredentialStore;
import org.areaflow.engine.credential.TokenCrypto;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Clock;
import java.time.Instant;

/**
 * Base for providers that refresh through a standard OAuth2 token endpoint
 * ({@code grant_type=refresh_token}) and store linked grants in the credential store.
 */
@Slf4j
public abstract class OAuth2ProviderPlugin implements IdentityProvider, LinkingProvider {

    private final CredentialStore credentialStore;
    private final TokenCrypto tokenCrypto;
    private final RestClient restClient;
    private final Clock clock;

    protected OAuth2ProviderPlugin(CredentialStore credentialStore, TokenCrypto tokenCrypto,
                                   RestClient.Builder restClientBuilder, Clock clock) {
        this.credentialStore = credentialStore;
        this.tokenCrypto = tokenCrypto;
        this.restClient = restClientBuilder.build();
        this.clock = clock;
    }

    protected abstract String tokenUri();

    protected abstract String clientId();

    protected abstract String clientSecret();

    /**
     * Add client authentication to the refresh request, either as headers or as form fields.
     */
    protected abstract void authenticateClient(HttpHeaders headers, MultiValueMap<String, String> form);

    @Override
    public TokenGrant refresh(String userId) {
        if (isBlank(clientId()) || isBlank(clientSecret())) {
            throw new TokenRefreshFailedException(key(), key() + " client credentials are not configured");
        }
        String refreshToken = credentialStore.get(userId, key())
                .map(Credential::refreshToken)
                .flatMap(tokenCrypto::decrypt)
                .orElseThrow(() -> new TokenRefreshFailedException(key(),
                        "No usable " + key() + " refresh token for user " + userId));

        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken);
        HttpHeaders clientAuth = new HttpHeaders();
        authenticateClient(clientAuth, form);

        JsonNode body;
        try {
            body = restClient.post()
                    .uri(tokenUri())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .headers(headers -> headers.addAll(clientAuth))
                    .body(form)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new TokenRefreshFailedException(key(), key() + " token endpoint rejected refresh: " + e.getMessage(), e);
        }

        String accessToken = body == null ? null : body.path("access_token").asText(null);
        if (isBlank(accessToken)) {
            throw new TokenRefreshFailedException(key(), key() + " token endpoint returned no access_token");
        }
        Instant expiresAt = body.hasNonNull("expires_in")
                ? clock.instant().plusSeconds(body.get("expires_in").asLong())
                : null;
        String rotated = body.path("refresh_token").asText(null);

        log.info("Refreshed access token: provider={}, userId={}, expiresAt={}", key(), userId, expiresAt);
        return new TokenGrant(accessToken, rotated, expiresAt);
    }

    @Override
    public void link(String userId, TokenGrant grant) {
        String refreshCipher = grant.refreshToken() == null ? null : tokenCrypto.encrypt(grant.refreshToken());
        credentialStore.save(userId, key(),
                new Credential(tokenCrypto.encrypt(grant.accessToken()), refreshCipher, grant.expiresAt()));
        log.info("Linked account: provider={}, userId={}", key(), userId);
    }

    @Override
    public void unlink(String userId) {
        credentialStore.clear(userId, key());
        log.info("Unlinked account: provider={}, userId={}", key(), userId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
