package org.areaflow.engine.credential;

import java.util.Optional;

/**
 * Symmetric encryption of provider tokens at rest.
 */
public interface TokenCrypto {

    String encrypt(String plain);

    /**
     * @return the plaintext, or empty if the payload cannot be decoded or authenticated
     */
    Optional<String> decrypt(String cipher);
}
