package com.tessera.secrets;

/**
 * Placeholder for a remote secret store (parameter store, managed secrets, vault).
 * <p>
 * Selecting one of these backends is allowed, but every lookup fails with
 * {@link SecretResolutionException.Kind#NOT_IMPLEMENTED}. There is deliberately no fallback to
 * another backend once a remote one has been chosen.
 */
public final class UnimplementedSecretProvider implements SecretProvider {

    private final SecretBackend backend;
    private final String location;

    /**
     * @param backend  the remote backend being stood in for
     * @param location where the integration would connect (region or address), for diagnostics
     */
    public UnimplementedSecretProvider(SecretBackend backend, String location) {
        if (!backend.isRemote()) {
            throw new IllegalArgumentException("backend must be remote: " + backend.selector());
        }
        this.backend = backend;
        this.location = location;
    }

    @Override
    public byte[] getSecret(String name) {
        throw new SecretResolutionException(SecretResolutionException.Kind.NOT_IMPLEMENTED, name,
                "%s integration not implemented yet (location: %s)".formatted(backend.selector(), location));
    }

    @Override
    public SecretBackend backend() {
        return backend;
    }

    public String location() {
        return location;
    }
}
