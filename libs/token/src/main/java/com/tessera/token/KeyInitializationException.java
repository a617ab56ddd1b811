package com.tessera.token;

/**
 * Signing key material is missing or unusable.
 * <p>
 * This is a configuration defect: it is raised at startup or reload and is not recoverable per
 * request.
 */
public class KeyInitializationException extends RuntimeException {

    public enum Kind {
        /** No key ring has been installed yet. */
        KEY_NOT_INITIALIZED,
        /** The private and public keys do not form a pair. */
        KEY_MISMATCH,
        /** The key could not be parsed or is too weak. */
        INVALID_KEY
    }

    private final Kind kind;

    public KeyInitializationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public KeyInitializationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
