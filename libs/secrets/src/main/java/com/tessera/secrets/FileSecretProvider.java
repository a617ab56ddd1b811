package com.tessera.secrets;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Resolves secrets from files under a base directory, as mounted by Docker or Kubernetes
 * secret volumes.
 * <p>
 * The file name is the lower-cased secret name: {@code JWT_PRIVATE_KEY} is read from
 * {@code <basePath>/jwt_private_key}. Bytes are returned as stored, trailing newlines included;
 * {@link SecretResolver#getSecretString} trims the string form.
 */
public final class FileSecretProvider implements SecretProvider {

    /** Default mount point for container secrets. */
    public static final String DEFAULT_BASE_PATH = "/run/secrets";

    private final Path basePath;

    public FileSecretProvider(Path basePath) {
        this.basePath = Objects.requireNonNull(basePath, "basePath");
    }

    @Override
    public byte[] getSecret(String name) {
        Path file = resolve(name);
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new SecretResolutionException(SecretResolutionException.Kind.SECRET_UNAVAILABLE, name,
                    "failed to read secret file %s".formatted(file), e);
        }
    }

    /** The file a given secret name maps to. */
    public Path resolve(String name) {
        return basePath.resolve(name.toLowerCase(Locale.ROOT));
    }

    public Path basePath() {
        return basePath;
    }

    @Override
    public SecretBackend backend() {
        return SecretBackend.FILE;
    }
}
