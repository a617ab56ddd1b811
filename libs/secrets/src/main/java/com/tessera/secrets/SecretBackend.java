package com.tessera.secrets;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Supported secret backends, keyed by their configuration selector.
 * <p>
 * {@code ENV} and {@code FILE} are implemented locally. The remote providers are declared so
 * they can be selected explicitly, and fail fast with
 * {@link SecretResolutionException.Kind#NOT_IMPLEMENTED} until an integration exists.
 */
public enum SecretBackend {

    ENV("env", false),
    FILE("file", false),
    AWS_SSM("aws_ssm", true),
    AWS_SECRETS("aws_secrets", true),
    VAULT("vault", true);

    private final String selector;
    private final boolean remote;

    SecretBackend(String selector, boolean remote) {
        this.selector = selector;
        this.remote = remote;
    }

    /** The configuration value that selects this backend (e.g. {@code "aws_ssm"}). */
    public String selector() {
        return selector;
    }

    /** Whether this backend talks to a remote secret store. */
    public boolean isRemote() {
        return remote;
    }

    /**
     * Looks up a backend by its selector, ignoring case and surrounding whitespace.
     *
     * @param selector the configured value (may be null)
     * @return the matching backend, or empty if unknown
     */
    public static Optional<SecretBackend> fromSelector(String selector) {
        if (selector == null) {
            return Optional.empty();
        }
        String normalized = selector.strip();
        for (SecretBackend backend : values()) {
            if (backend.selector.equalsIgnoreCase(normalized)) {
                return Optional.of(backend);
            }
        }
        return Optional.empty();
    }

    /**
     * Strict variant of {@link #fromSelector(String)} for configuration checks.
     *
     * @throws IllegalArgumentException naming the accepted selectors when the value is unknown
     */
    public static SecretBackend validate(String selector) {
        return fromSelector(selector).orElseThrow(() -> new IllegalArgumentException(
                "invalid secret provider '%s', must be one of: %s".formatted(selector, selectors())));
    }

    /** All accepted selectors, in declaration order. */
    public static List<String> selectors() {
        return Arrays.stream(values()).map(SecretBackend::selector).toList();
    }
}
