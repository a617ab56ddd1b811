package com.tessera.token;

import java.time.Instant;

/**
 * The credential set returned to a client after login, registration or refresh.
 *
 * @param accessToken  signed access token
 * @param idToken      signed identity token
 * @param refreshToken signed refresh token
 * @param expiresIn    access token lifetime in seconds
 * @param tokenType    always {@value #BEARER}
 * @param issuedAt     issuance time
 */
public record TokenBundle(
        String accessToken,
        String idToken,
        String refreshToken,
        long expiresIn,
        String tokenType,
        Instant issuedAt
) {

    public static final String BEARER = "Bearer";
}
