package com.tessera.security;

/**
 * An authorization decision together with what produced it.
 *
 * @param decision the decision
 * @param basis    why it was reached, for diagnostics only
 */
public record AuthorizationResult(Decision decision, Basis basis) {

    public enum Basis {
        /** A flat permission matched. */
        PERMISSION,
        /** A policy allow statement fired. */
        POLICY_ALLOW,
        /** A policy deny statement fired, overriding any allow. */
        EXPLICIT_DENY,
        /** Nothing matched. */
        NO_MATCH,
        /** The request itself was unusable (missing principal, blank or unparsable action or resource). */
        INVALID_REQUEST
    }

    public boolean allowed() {
        return decision == Decision.ALLOW;
    }

    static AuthorizationResult allow(Basis basis) {
        return new AuthorizationResult(Decision.ALLOW, basis);
    }

    static AuthorizationResult deny(Basis basis) {
        return new AuthorizationResult(Decision.DENY, basis);
    }
}
