package com.tessera.secrets;

import java.nio.charset.StandardCharsets;

/**
 * A single backing store for named secrets.
 * <p>
 * Implementations resolve one logical name (already prefixed by the caller) to raw bytes.
 * They do not retry and do not validate length; {@link SecretResolver} owns both concerns.
 */
public interface SecretProvider {

    /**
     * Resolves the secret bytes for the given name.
     *
     * @param name the fully-qualified secret name
     * @return the raw secret bytes
     * @throws SecretResolutionException if the backend cannot produce the secret
     */
    byte[] getSecret(String name);

    /**
     * Resolves the secret as a UTF-8 string.
     */
    default String getSecretString(String name) {
        return new String(getSecret(name), StandardCharsets.UTF_8);
    }

    /** The backend this provider implements. */
    SecretBackend backend();
}
