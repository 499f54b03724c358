package org.areaflow.engine.provider;

/**
 * Attaches or detaches a user's account on one external service.
 * The OAuth authorization-code exchange happens elsewhere; this only stores its result.
 */
public interface LinkingProvider {

    String key();

    void link(String userId, TokenGrant grant);

    void unlink(String userId);
}
