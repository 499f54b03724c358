package org.areaflow.engine.provider;

import org.areaflow.engine.credential.CredentialStore;
import org.areaflow.engine.credential.TokenCrypto;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/**
 * Google OAuth2. Client credentials travel as form fields.
 */
@Component
public class GoogleProvider extends OAuth2ProviderPlugin {

    public static final String KEY = "google";

    private final String clientId;
    private final String clientSecret;
    private final String tokenUri;

    public GoogleProvider(CredentialStore credentialStore, TokenCrypto tokenCrypto,
                          RestClient.Builder restClientBuilder, Clock clock,
                          @Value("${area.engine.providers.google.client-id:}") String clientId,
                          @Value("${area.engine.providers.google.client-secret:}") String clientSecret,
                          @Value("${area.engine.providers.google.token-uri:https://oauth2.googleapis.com/token}") String tokenUri) {
        super(credentialStore, tokenCrypto, restClientBuilder, clock);
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.tokenUri = tokenUri;
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    protected String tokenUri() {
        return tokenUri;
    }

    @Override
    protected String clientId() {
        return clientId;
    }

    @Override
    protected String clientSecret() {
        return clientSecret;
    }

    @Override
    protected void authenticateClient(HttpHeaders headers, MultiValueMap<String, String> form) {
        form.add("client_id", clientId);
        form.add("client_secret", clientSecret);
    }
}
