package org.areaflow.engine.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Registry built once from the provider plugins present in the context.
 */
@Component
@Slf4j
public class DefaultProviderRegistry implements ProviderRegistry {

    private final Map<String, IdentityProvider> identities;
    private final Map<String, LinkingProvider> linkings;
    private final List<String> providerKeys;

    public DefaultProviderRegistry(List<IdentityProvider> identityProviders,
                                   List<LinkingProvider> linkingProviders) {
        this.identities = index(identityProviders, IdentityProvider::key);
        this.linkings = index(linkingProviders, LinkingProvider::key);

        TreeSet<String> keys = new TreeSet<>(identities.keySet());
        keys.addAll(linkings.keySet());
        this.providerKeys = List.copyOf(keys);
        log.info("Provider registry initialized: providers={}", providerKeys);
    }

    @Override
    public Optional<IdentityProvider> getIdentity(String providerKey) {
        return Optional.ofNullable(providerKey).map(identities::get);
    }

    @Override
    public Optional<LinkingProvider> getLinking(String providerKey) {
        return Optional.ofNullable(providerKey).map(linkings::get);
    }

    @Override
    public List<String> listProviders() {
        return providerKeys;
    }

    private static <T> Map<String, T> index(Collection<T> plugins, Function<T, String> keyOf) {
        return plugins.stream().collect(Collectors.toUnmodifiableMap(keyOf, Function.identity(), (a, b) -> {
            throw new IllegalStateException("Duplicate provider key: " + keyOf.apply(a));
        }));
    }
}
