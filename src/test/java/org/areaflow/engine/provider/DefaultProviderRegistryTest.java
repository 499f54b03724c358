package org.areaflow.engine.provider;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DefaultProviderRegistryTest {

    private static IdentityProvider identity(String key) {
        IdentityProvider provider = mock(IdentityProvider.class);
        when(provider.key()).thenReturn(key);
        return provider;
    }

    private static LinkingProvider linking(String key) {
        LinkingProvider provider = mock(LinkingProvider.class);
        when(provider.key()).thenReturn(key);
        return provider;
    }

    @Test
    void shouldResolveKnownKeysAndReturnEmptyForUnknown() {
        IdentityProvider spotify = identity("spotify");
        DefaultProviderRegistry registry = new DefaultProviderRegistry(List.of(spotify), List.of(linking("google")));

        assertSame(spotify, registry.getIdentity("spotify").orElseThrow());
        assertTrue(registry.getIdentity("google").isEmpty());
        assertTrue(registry.getLinking("google").isPresent());
        assertTrue(registry.getIdentity("unknown").isEmpty());
        assertTrue(registry.getIdentity(null).isEmpty());
    }

    @Test
    void shouldListProvidersSorted() {
        DefaultProviderRegistry registry = new DefaultProviderRegistry(
                List.of(identity("spotify"), identity("google")), List.of(linking("spotify")));

        assertEquals(List.of("google", "spotify"), registry.listProviders());
        assertThrows(UnsupportedOperationException.class, () -> registry.listProviders().add("x"));
    }

    @Test
    void shouldRejectDuplicateKeys() {
        assertThrows(IllegalStateException.class,
                () -> new DefaultProviderRegistry(List.of(identity("spotify"), identity("spotify")), List.of()));
    }
}
