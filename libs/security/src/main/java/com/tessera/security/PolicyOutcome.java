package com.tessera.security;

/** What a set of policy documents says about one request. */
public enum PolicyOutcome {
    /** An allow statement fired and no deny statement did. */
    ALLOW,
    /** A deny statement fired. */
    DENY,
    /** No statement fired. */
    SILENT
}
