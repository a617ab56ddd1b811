package com.tessera.secrets;

/**
 * Raised when a secret cannot be resolved.
 * <p>
 * Every kind is a startup-time failure: a process that cannot load its key material must not
 * serve traffic. Messages carry the secret name, never its value.
 */
public class SecretResolutionException extends RuntimeException {

    /** Closed set of resolution failures. */
    public enum Kind {
        /** The backend could not produce the secret; may be transient and is retried. */
        SECRET_UNAVAILABLE,
        /** The backend produced zero bytes. */
        EMPTY_SECRET,
        /** The selected backend has no integration yet. */
        NOT_IMPLEMENTED
    }

    private final Kind kind;
    private final String secretName;

    public SecretResolutionException(Kind kind, String secretName, String message) {
        super(message);
        this.kind = kind;
        this.secretName = secretName;
    }

    public SecretResolutionException(Kind kind, String secretName, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.secretName = secretName;
    }

    public Kind kind() {
        return kind;
    }

    public String secretName() {
        return secretName;
    }

    /** Whether {@link SecretResolver} may retry this failure. */
    public boolean isRetryable() {
        return kind == Kind.SECRET_UNAVAILABLE;
    }
}
