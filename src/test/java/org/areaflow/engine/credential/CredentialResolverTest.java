package org.areaflow.engine.credential;

import com.fasterxml.jackson.databind.json.JsonMapper;
import org.areaflow.engine.api.exception.AuthenticationExhaustedException;
import org.areaflow.engine.api.exception.InvalidTokenException;
import org.areaflow.engine.api.exception.NoLinkedAccountException;
import org.areaflow.engine.api.exception.ProviderUnauthorizedException;
import org.areaflow.engine.api.exception.TokenRefreshFailedException;
import org.areaflow.engine.provider.IdentityProvider;
import org.areaflow.engine.provider.ProviderRegistry;
import org.areaflow.engine.provider.TokenGrant;
import org.areaflow.engine.store.InMemoryKeyValueStore;
import org.areaflow.engine.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CredentialResolverTest {

    private static final String USER = "u1";
    private static final String PROVIDER = "spotify";

    @Mock
    private ProviderRegistry providerRegistry;

    @Mock
    private IdentityProvider identityProvider;

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final TokenCrypto crypto = new AesGcmTokenCrypto("test-secret");
    private CredentialStore credentialStore;
    private CredentialResolver resolver;

    @BeforeEach
    void setUp() {
        credentialStore = new KeyValueCredentialStore(new InMemoryKeyValueStore(clock),
                JsonMapper.builder().findAndAddModules().build());
        resolver = new CredentialResolver(credentialStore, crypto, providerRegistry, clock);
    }

    private void storeCredential(String accessToken, Instant expiresAt) {
        credentialStore.save(USER, PROVIDER,
                new Credential(crypto.encrypt(accessToken), crypto.encrypt("refresh-1"), expiresAt));
    }

    @Test
    void shouldFailWithNoLinkedAccountWhenCredentialMissing() {
        assertThatThrownBy(() -> resolver.withAccessToken(USER, PROVIDER, token -> token))
                .isInstanceOf(NoLinkedAccountException.class);
        verifyNoInteractions(providerRegistry);
    }

    @Test
    void shouldFailWithInvalidTokenWhenDecryptFails() {
        credentialStore.save(USER, PROVIDER, new Credential("garbage", null, null));

        assertThatThrownBy(() -> resolver.withAccessToken(USER, PROVIDER, token -> token))
                .isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void shouldPassDecryptedTokenWhenNotExpired() {
        storeCredential("access-1", clock.instant().plus(Duration.ofHours(1)));

        String result = resolver.withAccessToken(USER, PROVIDER, token -> "called with " + token);

        assertThat(result).isEqualTo("called with access-1");
        verifyNoInteractions(providerRegistry);
    }

    @Test
    @DisplayName("expired token: exactly one refresh, new token persisted encrypted")
    void shouldRefreshExpiredTokenOnceAndPersistIt() {
        storeCredential("access-1", clock.instant().minusSeconds(1));
        when(providerRegistry.getIdentity(PROVIDER)).thenReturn(Optional.of(identityProvider));
        when(identityProvider.refresh(USER))
                .thenReturn(new TokenGrant("access-2", "refresh-2", clock.instant().plus(Duration.ofHours(1))));

        String result = resolver.withAccessToken(USER, PROVIDER, token -> token);

        assertThat(result).isEqualTo("access-2");
        verify(identityProvider, times(1)).refresh(USER);
        Credential stored = credentialStore.get(USER, PROVIDER).orElseThrow();
        assertThat(stored.accessToken()).isNotEqualTo("access-2");
        assertThat(crypto.decrypt(stored.accessToken())).contains("access-2");
        assertThat(crypto.decrypt(stored.refreshToken())).contains("refresh-2");
        assertThat(stored.expiresAt()).isEqualTo(clock.instant().plus(Duration.ofHours(1)));
    }

    @Test
    void shouldRaiseAuthenticationExhaustedWhenRefreshFails() {
        storeCredential("access-1", clock.instant().minusSeconds(1));
        when(providerRegistry.getIdentity(PROVIDER)).thenReturn(Optional.of(identityProvider));
        when(identityProvider.refresh(USER)).thenThrow(new TokenRefreshFailedException(PROVIDER, "invalid_grant"));
        List<String> calls = new ArrayList<>();

        assertThatThrownBy(() -> resolver.withAccessToken(USER, PROVIDER, calls::add))
                .isInstanceOf(AuthenticationExhaustedException.class)
                .hasCauseInstanceOf(TokenRefreshFailedException.class);
        verify(identityProvider, times(1)).refresh(USER);
        assertThat(calls).isEmpty();
    }

    @Test
    void shouldRefreshOnceAndRetryAfterUnauthorized() {
        storeCredential("access-1", clock.instant().plus(Duration.ofHours(1)));
        when(providerRegistry.getIdentity(PROVIDER)).thenReturn(Optional.of(identityProvider));
        when(identityProvider.refresh(USER)).thenReturn(new TokenGrant("access-2", null, null));
        List<String> calls = new ArrayList<>();

        String result = resolver.withAccessToken(USER, PROVIDER, token -> {
            calls.add(token);
            if (token.equals("access-1")) {
                throw new ProviderUnauthorizedException(PROVIDER, null);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).containsExactly("access-1", "access-2");
        assertThat(crypto.decrypt(credentialStore.get(USER, PROVIDER).orElseThrow().refreshToken()))
                .contains("refresh-1");
    }

    @Test
    void shouldNotRefreshTwiceWhenRefreshedTokenIsRejected() {
        storeCredential("access-1", clock.instant().plus(Duration.ofHours(1)));
        when(providerRegistry.getIdentity(PROVIDER)).thenReturn(Optional.of(identityProvider));
        when(identityProvider.refresh(USER)).thenReturn(new TokenGrant("access-2", null, null));

        assertThatThrownBy(() -> resolver.withAccessToken(USER, PROVIDER, token -> {
            throw new ProviderUnauthorizedException(PROVIDER, null);
        })).isInstanceOf(AuthenticationExhaustedException.class);

        verify(identityProvider, times(1)).refresh(USER);
    }

    @Test
    void shouldNotRefreshAgainWhenPreemptivelyRefreshedTokenIsRejected() {
        storeCredential("access-1", clock.instant().minusSeconds(1));
        when(providerRegistry.getIdentity(PROVIDER)).thenReturn(Optional.of(identityProvider));
        when(identityProvider.refresh(USER)).thenReturn(new TokenGrant("access-2", null, null));

        assertThatThrownBy(() -> resolver.withAccessToken(USER, PROVIDER, token -> {
            throw new ProviderUnauthorizedException(PROVIDER, null);
        })).isInstanceOf(AuthenticationExhaustedException.class);

        verify(identityProvider, times(1)).refresh(USER);
    }

    @Test
    void shouldRaiseAuthenticationExhaustedWhenNoIdentityProvider() {
        storeCredential("access-1", clock.instant().minusSeconds(1));
        when(providerRegistry.getIdentity(PROVIDER)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> resolver.withAccessToken(USER, PROVIDER, token -> token))
                .isInstanceOf(AuthenticationExhaustedException.class);
    }
}
