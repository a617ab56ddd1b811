package com.tessera.secrets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Optional;
import java.util.function.Function;

/**
 * Selects the {@link SecretProvider} for a {@link SecretsConfig}.
 * <p>
 * A blank selector or an unknown one resolves to the environment-variable backend. An unknown
 * selector is logged at WARN so the misconfiguration is visible, but never falls back to a
 * built-in secret.
 */
public final class SecretProviders {

    private static final Logger log = LoggerFactory.getLogger(SecretProviders.class);

    private SecretProviders() {
        // utility class
    }

    /**
     * Selects a provider reading from the real process environment.
     */
    public static SecretProvider select(SecretsConfig config) {
        return select(config, System::getenv);
    }

    /**
     * Selects a provider; {@code environment} backs the {@code env} backend.
     */
    public static SecretProvider select(SecretsConfig config, Function<String, String> environment) {
        Optional<SecretBackend> selected = SecretBackend.fromSelector(config.backend());
        if (selected.isEmpty()) {
            if (config.backend().isEmpty()) {
                log.info("No secret provider configured, using environment variables");
            } else {
                log.warn("Unknown secret provider '{}', falling back to environment variables (accepted: {})",
                        config.backend(), SecretBackend.selectors());
            }
            return new EnvironmentSecretProvider(environment);
        }
        SecretBackend backend = selected.get();
        return switch (backend) {
            case ENV -> {
                log.info("Using environment variable secret provider");
                yield new EnvironmentSecretProvider(environment);
            }
            case FILE -> {
                log.info("Using file secret provider (path: {})", config.filePath());
                yield new FileSecretProvider(Path.of(config.filePath()));
            }
            case AWS_SSM, AWS_SECRETS -> {
                log.info("Using {} secret provider (region: {}, prefix: '{}')",
                        backend.selector(), config.region(), config.prefix());
                yield new UnimplementedSecretProvider(backend, config.region());
            }
            case VAULT -> {
                log.info("Using vault secret provider (address: {}, prefix: '{}')",
                        config.vaultAddress(), config.prefix());
                yield new UnimplementedSecretProvider(backend, config.vaultAddress());
            }
        };
    }
}
