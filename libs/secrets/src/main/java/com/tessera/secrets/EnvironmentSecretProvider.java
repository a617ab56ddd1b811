package com.tessera.secrets;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves secrets from environment variables.
 * <p>
 * A value of the form {@code base64:<data>} is decoded, so binary key material can be passed
 * through the environment. Any other value is returned as its UTF-8 bytes.
 */
public final class EnvironmentSecretProvider implements SecretProvider {

    /** Prefix marking a base64-encoded value. */
    public static final String BASE64_PREFIX = "base64:";

    private final Function<String, String> environment;

    /** Reads from the real process environment. */
    public EnvironmentSecretProvider() {
        this(System::getenv);
    }

    /**
     * Reads from the given lookup function (returns null for unset variables).
     */
    public EnvironmentSecretProvider(Function<String, String> environment) {
        this.environment = Objects.requireNonNull(environment, "environment");
    }

    @Override
    public byte[] getSecret(String name) {
        String value = environment.apply(name);
        if (value == null || value.isEmpty()) {
            throw new SecretResolutionException(SecretResolutionException.Kind.SECRET_UNAVAILABLE, name,
                    "environment variable %s is not set".formatted(name));
        }
        if (value.startsWith(BASE64_PREFIX)) {
            try {
                return Base64.getDecoder().decode(value.substring(BASE64_PREFIX.length()).strip());
            } catch (IllegalArgumentException e) {
                throw new SecretResolutionException(SecretResolutionException.Kind.SECRET_UNAVAILABLE, name,
                        "failed to decode base64 secret %s".formatted(name), e);
            }
        }
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public SecretBackend backend() {
        return SecretBackend.ENV;
    }
}
