package org.areaflow.engine.provider;

import com.fasterxml.jackson.databind.json.JsonMapper;
import org.areaflow.engine.api.exception.TokenRefreshFailedException;
import org.areaflow.engine.credential.AesGcmTokenCrypto;
import org.areaflow.engine.credential.Credential;
import org.areaflow.engine.credential.CredentialStore;
import org.areaflow.engine.credential.KeyValueCredentialStore;
import org.areaflow.engine.credential.TokenCrypto;
import org.areaflow.engine.store.InMemoryKeyValueStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Base64;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.http.HttpStatus.BAD_REQUEST;

class OAuth2ProviderPluginTest {

    private static final String TOKEN_URI = "https://accounts.example.test/api/token";

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);
    private final TokenCrypto crypto = new AesGcmTokenCrypto("test-secret");
    private CredentialStore credentialStore;
    private RestClient.Builder restClientBuilder;
    private MockRestServiceServer server;

    @BeforeEach
    void setUp() {
        credentialStore = new KeyValueCredentialStore(new InMemoryKeyValueStore(clock),
                JsonMapper.builder().findAndAddModules().build());
        restClientBuilder = RestClient.builder();
        server = MockRestServiceServer.bindTo(restClientBuilder).build();
    }

    private SpotifyProvider spotify() {
        return new SpotifyProvider(credentialStore, crypto, restClientBuilder, clock, "cid", "csecret", TOKEN_URI);
    }

    private GoogleProvider google() {
        return new GoogleProvider(credentialStore, crypto, restClientBuilder, clock, "gid", "gsecret", TOKEN_URI);
    }

    @Test
    void shouldRefreshSpotifyTokenWithBasicClientAuth() {
        SpotifyProvider provider = spotify();
        provider.link("u1", new TokenGrant("access-1", "refresh-1", null));
        String basic = "Basic " + Base64.getEncoder().encodeToString("cid:csecret".getBytes(StandardCharsets.UTF_8));
        server.expect(requestTo(TOKEN_URI))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, basic))
                .andExpect(content().string(containsString("grant_type=refresh_token")))
                .andExpect(content().string(containsString("refresh_token=refresh-1")))
                .andExpect(content().string(not(containsString("client_secret"))))
                .andRespond(withSuccess("{\"access_token\": \"access-2\", \"expires_in\": 3600}", MediaType.APPLICATION_JSON));

        TokenGrant grant = provider.refresh("u1");

        server.verify();
        assertEquals("access-2", grant.accessToken());
        assertNull(grant.refreshToken());
        assertEquals(Instant.parse("2024-05-01T11:00:00Z"), grant.expiresAt());
    }

    @Test
    void shouldRefreshGoogleTokenWithFormClientCredentials() {
        GoogleProvider provider = google();
        provider.link("u1", new TokenGrant("access-1", "refresh-1", null));
        server.expect(requestTo(TOKEN_URI))
                .andExpect(content().string(containsString("client_id=gid")))
                .andExpect(content().string(containsString("client_secret=gsecret")))
                .andRespond(withSuccess("{\"access_token\": \"access-2\", \"refresh_token\": \"refresh-2\"}",
                        MediaType.APPLICATION_JSON));

        TokenGrant grant = provider.refresh("u1");

        server.verify();
        assertEquals("refresh-2", grant.refreshToken());
        assertNull(grant.expiresAt());
    }

    @Test
    void shouldFailRefreshWhenTokenEndpointRejects() {
        SpotifyProvider provider = spotify();
        provider.link("u1", new TokenGrant("access-1", "refresh-1", null));
        server.expect(requestTo(TOKEN_URI))
                .andRespond(withStatus(BAD_REQUEST).contentType(MediaType.APPLICATION_JSON)
                        .body("{\"error\": \"invalid_grant\"}"));

        assertThrows(TokenRefreshFailedException.class, () -> provider.refresh("u1"));
    }

    @Test
    void shouldFailRefreshWithoutStoredRefreshToken() {
        SpotifyProvider provider = spotify();
        provider.link("u1", new TokenGrant("access-1", null, null));

        assertThrows(TokenRefreshFailedException.class, () -> provider.refresh("u1"));
        server.verify();
    }

    @Test
    void shouldFailRefreshWhenClientNotConfigured() {
        SpotifyProvider provider = new SpotifyProvider(credentialStore, crypto, restClientBuilder, clock, "", "", TOKEN_URI);

        assertThrows(TokenRefreshFailedException.class, () -> provider.refresh("u1"));
    }

    @Test
    void shouldStoreOnlyCiphertextOnLinkAndClearOnUnlink() {
        SpotifyProvider provider = spotify();

        provider.link("u1", new TokenGrant("access-1", "refresh-1", Instant.parse("2024-05-01T11:00:00Z")));

        Credential stored = credentialStore.get("u1", "spotify").orElseThrow();
        assertNotEquals("access-1", stored.accessToken());
        assertEquals("access-1", crypto.decrypt(stored.accessToken()).orElseThrow());
        assertEquals("refresh-1", crypto.decrypt(stored.refreshToken()).orElseThrow());

        provider.unlink("u1");
        assertTrue(credentialStore.get("u1", "spotify").isEmpty());
    }
}
