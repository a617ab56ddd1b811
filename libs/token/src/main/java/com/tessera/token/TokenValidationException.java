package com.tessera.token;

/**
 * Raised when a presented credential fails verification.
 * <p>
 * The {@link Reason} is for internal diagnostics and logs only. Callers outside the core must
 * map every reason to the same "unauthenticated" outcome so the response does not reveal which
 * check failed.
 */
public class TokenValidationException extends RuntimeException {

    /** Closed set of verification failures. */
    public enum Reason {
        MALFORMED_TOKEN,
        UNSUPPORTED_ALGORITHM,
        UNKNOWN_KEY,
        INVALID_SIGNATURE,
        MISSING_CLAIM,
        EXPIRED_TOKEN,
        NOT_YET_VALID,
        TOKEN_TYPE_MISMATCH
    }

    private final Reason reason;

    public TokenValidationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public TokenValidationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
