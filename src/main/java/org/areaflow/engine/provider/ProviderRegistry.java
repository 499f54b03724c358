package org.areaflow.engine.provider;

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookup of provider plugins by key. Unknown keys resolve to empty.
 */
public interface ProviderRegistry {

    Optional<IdentityProvider> getIdentity(String providerKey);

    Optional<LinkingProvider> getLinking(String providerKey);

    List<String> listProviders();
}
