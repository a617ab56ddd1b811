package com.tessera.secrets;

import java.time.Duration;

/**
 * Process-wide secret resolution settings, read once at startup.
 *
 * @param backend      backend selector ({@code env}, {@code file}, {@code aws_ssm},
 *                     {@code aws_secrets}, {@code vault}); blank means {@code env}
 * @param prefix       prefix prepended to every logical secret name (may be empty)
 * @param filePath     base directory for the {@code file} backend
 * @param region       region for the AWS backends
 * @param vaultAddress address of the vault backend
 * @param retryBackoff base delay between attempts; attempt {@code n} waits {@code n * retryBackoff}
 */
public record SecretsConfig(
        String backend,
        String prefix,
        String filePath,
        String region,
        String vaultAddress,
        Duration retryBackoff
) {

    public SecretsConfig {
        backend = backend == null ? "" : backend.strip();
        prefix = prefix == null ? "" : prefix;
        if (filePath == null || filePath.isBlank()) {
            filePath = FileSecretProvider.DEFAULT_BASE_PATH;
        }
        if (region == null || region.isBlank()) {
            region = "us-east-1";
        }
        if (vaultAddress == null || vaultAddress.isBlank()) {
            vaultAddress = "http://localhost:8200";
        }
        if (retryBackoff == null || retryBackoff.isNegative()) {
            retryBackoff = Duration.ofSeconds(1);
        }
    }

    /** Environment-variable backend, no prefix, default backoff. */
    public static SecretsConfig defaults() {
        return new SecretsConfig(null, null, null, null, null, null);
    }

    /** Returns a copy using the given backend selector. */
    public SecretsConfig withBackend(String selector) {
        return new SecretsConfig(selector, prefix, filePath, region, vaultAddress, retryBackoff);
    }

    /** Returns a copy using the given retry backoff. */
    public SecretsConfig withRetryBackoff(Duration backoff) {
        return new SecretsConfig(backend, prefix, filePath, region, vaultAddress, backoff);
    }
}
