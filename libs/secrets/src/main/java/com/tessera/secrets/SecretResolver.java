package com.tessera.secrets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Resolves named secrets through the configured {@link SecretProvider}.
 * <p>
 * Lookups prepend the configured prefix, retry {@link SecretResolutionException.Kind#SECRET_UNAVAILABLE}
 * failures up to {@value #MAX_ATTEMPTS} attempts with linear backoff, and reject empty results.
 * Only the secret name and its length are ever logged.
 * <p>
 * Intended for startup and explicit reloads. Callers must not hold any lock that request
 * handling depends on while calling, since retries sleep.
 */
public final class SecretResolver {

    /** Total attempts per lookup, including the first. */
    public static final int MAX_ATTEMPTS = 3;

    private static final Logger log = LoggerFactory.getLogger(SecretResolver.class);

    private final SecretProvider provider;
    private final String prefix;
    private final Duration backoff;
    private final Sleeper sleeper;

    public SecretResolver(SecretProvider provider, SecretsConfig config) {
        this(provider, config, Sleeper.threadSleep());
    }

    public SecretResolver(SecretProvider provider, SecretsConfig config, Sleeper sleeper) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.prefix = config.prefix();
        this.backoff = config.retryBackoff();
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /** Builds a resolver for the configured backend, reading the real environment. */
    public static SecretResolver fromConfig(SecretsConfig config) {
        return new SecretResolver(SecretProviders.select(config), config);
    }

    /**
     * Resolves a secret by logical name.
     *
     * @param name logical secret name, without prefix
     * @return the non-empty secret bytes
     * @throws SecretResolutionException when every attempt fails, the secret is empty, or the
     *                                   backend is not implemented
     */
    public byte[] getSecret(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("secret name must not be blank");
        }
        String qualified = prefix + name;
        SecretResolutionException lastFailure = null;
        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            try {
                byte[] secret = provider.getSecret(qualified);
                if (secret == null || secret.length == 0) {
                    throw new SecretResolutionException(SecretResolutionException.Kind.EMPTY_SECRET, qualified,
                            "secret %s is empty".formatted(qualified));
                }
                log.info("Loaded secret {} ({} bytes) from {}", qualified, secret.length,
                        provider.backend().selector());
                return secret;
            } catch (SecretResolutionException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                lastFailure = e;
                if (attempt < MAX_ATTEMPTS) {
                    log.warn("Failed to load secret {} (attempt {}/{}): {}",
                            qualified, attempt, MAX_ATTEMPTS, e.getMessage());
                    pause(backoff.multipliedBy(attempt), qualified);
                }
            }
        }
        throw new SecretResolutionException(SecretResolutionException.Kind.SECRET_UNAVAILABLE, qualified,
                "failed to load secret %s after %d attempts".formatted(qualified, MAX_ATTEMPTS), lastFailure);
    }

    /**
     * Resolves a secret as a UTF-8 string, trimmed of surrounding whitespace.
     */
    public String getSecretString(String name) {
        String value = new String(getSecret(name), StandardCharsets.UTF_8).strip();
        if (value.isEmpty()) {
            throw new SecretResolutionException(SecretResolutionException.Kind.EMPTY_SECRET, prefix + name,
                    "secret %s is blank".formatted(prefix + name));
        }
        return value;
    }

    public SecretBackend backend() {
        return provider.backend();
    }

    private void pause(Duration delay, String qualified) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SecretResolutionException(SecretResolutionException.Kind.SECRET_UNAVAILABLE, qualified,
                    "interrupted while loading secret %s".formatted(qualified), e);
        }
    }
}
