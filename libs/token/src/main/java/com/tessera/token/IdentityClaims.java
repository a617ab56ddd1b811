package com.tessera.token;

import java.time.Instant;

/**
 * Claims specific to identity tokens.
 *
 * @param authTime when the subject authenticated
 * @param nonce    replay-binding value supplied by the client, or null
 * @param profile  profile claims, or null when none were issued
 */
public record IdentityClaims(Instant authTime, String nonce, UserProfile profile) {
}
