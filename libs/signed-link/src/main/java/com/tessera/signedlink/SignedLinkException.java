package com.tessera.signedlink;

/**
 * A signed link failed validation.
 * <p>
 * The reason is for logs and metrics. Responses to the link holder must not distinguish
 * between reasons.
 */
public class SignedLinkException extends RuntimeException {

    public enum Reason {
        MISSING_PARAMETERS,
        MALFORMED_EXPIRY,
        LINK_EXPIRED,
        INVALID_SIGNATURE
    }

    private final Reason reason;

    public SignedLinkException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
